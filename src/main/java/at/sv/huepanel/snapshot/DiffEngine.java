package at.sv.huepanel.snapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the minimal set of changed entities between two snapshots. Changed or added entities are reported with
 * their full current representation, entities missing from the current snapshot with a removal marker.
 */
public final class DiffEngine {

    /**
     * @param previous the previously sent snapshot, or null if none was stored yet
     * @param current  the newly fetched snapshot. Not null.
     * @return the delta, empty if {@code previous} is null or nothing changed
     */
    public Delta diff(Snapshot previous, Snapshot current) {
        if (current == null) {
            throw new IllegalArgumentException("Can't compute delta against missing current snapshot");
        }
        if (previous == null || previous.equals(current)) {
            return Delta.empty();
        }
        return new Delta(diff(previous.getLights(), current.getLights()),
                diff(previous.getRooms(), current.getRooms()),
                diff(previous.getZones(), current.getZones()),
                diff(previous.getMotionZones(), current.getMotionZones()));
    }

    private static <T> List<Change<T>> diff(Map<String, T> previous, Map<String, T> current) {
        List<Change<T>> changes = new ArrayList<>();
        current.forEach((id, entity) -> {
            if (!Objects.equals(previous.get(id), entity)) {
                changes.add(Change.changed(id, entity));
            }
        });
        previous.keySet()
                .stream()
                .filter(id -> !current.containsKey(id))
                .forEach(id -> changes.add(Change.removed(id)));
        return changes;
    }
}
