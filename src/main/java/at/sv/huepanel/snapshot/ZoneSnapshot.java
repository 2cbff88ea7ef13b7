package at.sv.huepanel.snapshot;

import lombok.Builder;

import java.util.List;

/**
 * A user defined grouping of lights. Unlike a room, a zone may span lights of several rooms.
 */
@Builder(toBuilder = true)
public record ZoneSnapshot(String id, String name, List<String> lightIds) {
    public ZoneSnapshot {
        lightIds = lightIds == null ? List.of() : List.copyOf(lightIds);
    }
}
