package at.sv.huepanel.snapshot;

import java.util.List;

public record Delta(List<Change<LightSnapshot>> lights, List<Change<RoomSnapshot>> rooms,
                    List<Change<ZoneSnapshot>> zones, List<Change<MotionZoneSnapshot>> motionZones) {

    private static final Delta EMPTY = new Delta(List.of(), List.of(), List.of(), List.of());

    public Delta {
        lights = List.copyOf(lights);
        rooms = List.copyOf(rooms);
        zones = List.copyOf(zones);
        motionZones = List.copyOf(motionZones);
    }

    public static Delta empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return lights.isEmpty() && rooms.isEmpty() && zones.isEmpty() && motionZones.isEmpty();
    }

    public int size() {
        return lights.size() + rooms.size() + zones.size() + motionZones.size();
    }
}
