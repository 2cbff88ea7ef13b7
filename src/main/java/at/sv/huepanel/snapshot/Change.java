package at.sv.huepanel.snapshot;

/**
 * A changed entity of a {@link Delta}: either the full current representation, or a removal marker.
 *
 * @param entity the current entity, null if removed
 */
public record Change<T>(String id, T entity, boolean removed) {

    public static <T> Change<T> changed(String id, T entity) {
        return new Change<>(id, entity, false);
    }

    public static <T> Change<T> removed(String id) {
        return new Change<>(id, null, true);
    }
}
