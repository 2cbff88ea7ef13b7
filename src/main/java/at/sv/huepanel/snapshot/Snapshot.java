package at.sv.huepanel.snapshot;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable full state of a bridge at one point in time. All entities are keyed by their id, iteration order is
 * the order in which they were provided.
 */
public final class Snapshot {

    private static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of(), Map.of(), Map.of());

    private final Map<String, LightSnapshot> lights;
    private final Map<String, RoomSnapshot> rooms;
    private final Map<String, ZoneSnapshot> zones;
    private final Map<String, MotionZoneSnapshot> motionZones;

    private Snapshot(Map<String, LightSnapshot> lights, Map<String, RoomSnapshot> rooms,
                     Map<String, ZoneSnapshot> zones, Map<String, MotionZoneSnapshot> motionZones) {
        this.lights = lights;
        this.rooms = rooms;
        this.zones = zones;
        this.motionZones = motionZones;
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    /**
     * Creates a snapshot without zones.
     */
    public static Snapshot of(Collection<LightSnapshot> lights, Collection<RoomSnapshot> rooms,
                              Collection<MotionZoneSnapshot> motionZones) {
        return of(lights, rooms, List.of(), motionZones);
    }

    public static Snapshot of(Collection<LightSnapshot> lights, Collection<RoomSnapshot> rooms,
                              Collection<ZoneSnapshot> zones, Collection<MotionZoneSnapshot> motionZones) {
        return new Snapshot(index(lights, LightSnapshot::id), index(rooms, RoomSnapshot::id),
                index(zones, ZoneSnapshot::id), index(motionZones, MotionZoneSnapshot::id));
    }

    private static <T> Map<String, T> index(Collection<T> entities, Function<T, String> idFunction) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T entity : entities) {
            if (map.put(idFunction.apply(entity), entity) != null) {
                throw new IllegalArgumentException("Duplicate id '" + idFunction.apply(entity) + "'");
            }
        }
        return Collections.unmodifiableMap(map);
    }

    public Map<String, LightSnapshot> getLights() {
        return lights;
    }

    public Map<String, RoomSnapshot> getRooms() {
        return rooms;
    }

    public Map<String, ZoneSnapshot> getZones() {
        return zones;
    }

    public Map<String, MotionZoneSnapshot> getMotionZones() {
        return motionZones;
    }

    public LightSnapshot getLight(String id) {
        return lights.get(id);
    }

    public List<LightSnapshot> lightList() {
        return List.copyOf(lights.values());
    }

    public List<RoomSnapshot> roomList() {
        return List.copyOf(rooms.values());
    }

    public List<ZoneSnapshot> zoneList() {
        return List.copyOf(zones.values());
    }

    public List<MotionZoneSnapshot> motionZoneList() {
        return List.copyOf(motionZones.values());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot snapshot)) return false;
        return lights.equals(snapshot.lights) && rooms.equals(snapshot.rooms) && zones.equals(snapshot.zones) &&
               motionZones.equals(snapshot.motionZones);
    }

    @Override
    public int hashCode() {
        int result = lights.hashCode();
        result = 31 * result + rooms.hashCode();
        result = 31 * result + zones.hashCode();
        result = 31 * result + motionZones.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "Snapshot{" +
               "lights=" + lights.size() +
               ", rooms=" + rooms.size() +
               ", zones=" + zones.size() +
               ", motionZones=" + motionZones.size() +
               '}';
    }
}
