package at.sv.huepanel.snapshot;

import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record RoomSnapshot(String id, String name, List<String> lightIds) {
    public RoomSnapshot {
        lightIds = lightIds == null ? List.of() : List.copyOf(lightIds);
    }
}
