package at.sv.huepanel.api.demo;

import at.sv.huepanel.api.SnapshotSource;
import at.sv.huepanel.snapshot.LightSnapshot;
import at.sv.huepanel.snapshot.MotionZoneSnapshot;
import at.sv.huepanel.snapshot.RoomSnapshot;
import at.sv.huepanel.snapshot.Snapshot;
import at.sv.huepanel.snapshot.ZoneSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Deterministic stand-in for a real bridge, used for demo connections. Holds a fixed home of 14 lights in three
 * rooms, two zones and four MotionAware zones. The state can be modified in memory and is shared by all demo connections.
 */
@Slf4j
public final class DemoSnapshotSource implements SnapshotSource {

    public static final String DEMO_BRIDGE_ADDRESS = "demo-bridge";
    public static final String DEMO_CREDENTIAL = "demo-user";

    private static final String LIVING_ROOM = "room-1";
    private static final String KITCHEN = "room-2";
    private static final String BEDROOM = "room-3";

    private final Map<String, LightSnapshot> lights = new LinkedHashMap<>();
    private final Map<String, MotionZoneSnapshot> motionZones = new LinkedHashMap<>();
    private final List<RoomSnapshot> rooms;
    private final List<ZoneSnapshot> zones;

    public DemoSnapshotSource() {
        rooms = List.of(
                new RoomSnapshot(LIVING_ROOM, "Living Room",
                        List.of("light-1", "light-2", "light-3", "light-4", "light-5", "light-6")),
                new RoomSnapshot(KITCHEN, "Kitchen", List.of("light-7", "light-8", "light-9")),
                new RoomSnapshot(BEDROOM, "Bedroom", List.of("light-10", "light-11", "light-12", "light-13", "light-14"))
        );
        zones = List.of(
                new ZoneSnapshot("zone-1", "Downstairs",
                        List.of("light-1", "light-2", "light-3", "light-7", "light-8", "light-9")),
                new ZoneSnapshot("zone-2", "Night Path", List.of("light-5", "light-9", "light-11", "light-12"))
        );
        reset();
    }

    /**
     * Restores the initial demo home.
     */
    public synchronized void reset() {
        lights.clear();
        addXyLight("light-1", "Floor Lamp", LIVING_ROOM, true, 100, 0.6915, 0.3083);
        addXyLight("light-2", "TV Backlight", LIVING_ROOM, true, 75, 0.1532, 0.0475);
        addXyLight("light-3", "Plant Light", LIVING_ROOM, true, 50, 0.17, 0.7);
        addXyLight("light-4", "Corner Lamp", LIVING_ROOM, true, 25, 0.5016, 0.4152);
        addXyLight("light-5", "Accent", LIVING_ROOM, true, 10, 0.3227, 0.329);
        addXyLight("light-6", "Ceiling", LIVING_ROOM, false, 0, 0.3227, 0.329);
        addCtLight("light-7", "Kitchen Ceiling", KITCHEN, 90, 153);
        addCtLight("light-8", "Counter", KITCHEN, 60, 250);
        addCtLight("light-9", "Under Cabinet", KITCHEN, 40, 400);
        addXyLight("light-10", "Bedroom Ceiling", BEDROOM, true, 80, 0.5614, 0.4156);
        addXyLight("light-11", "Bedside Left", BEDROOM, true, 45, 0.2731, 0.1601);
        addXyLight("light-12", "Bedside Right", BEDROOM, false, 0, 0.3227, 0.329);
        addXyLight("light-13", "Closet", BEDROOM, true, 5, 0.6915, 0.3083);
        addXyLight("light-14", "Reading", BEDROOM, true, 15, 0.1532, 0.0475);

        motionZones.clear();
        addMotionZone("motion-1", "Living Room");
        addMotionZone("motion-2", "Kitchen");
        addMotionZone("motion-3", "Hallway");
        addMotionZone("motion-4", "Garage");
    }

    private void addXyLight(String id, String name, String roomId, boolean on, double brightness, double x, double y) {
        lights.put(id, new LightSnapshot(id, name, roomId, on, brightness, x, y, null, true));
    }

    private void addCtLight(String id, String name, String roomId, double brightness, int mirek) {
        lights.put(id, new LightSnapshot(id, name, roomId, true, brightness, null, null, mirek, true));
    }

    private void addMotionZone(String id, String name) {
        motionZones.put(id, new MotionZoneSnapshot(id, name, false, true, true, null));
    }

    @Override
    public synchronized Snapshot getSnapshot(String bridgeAddress, String credential) {
        return Snapshot.of(new ArrayList<>(lights.values()), rooms, zones, new ArrayList<>(motionZones.values()));
    }

    public void setLightOn(String lightId, boolean on) {
        updateLight(lightId, light -> light.toBuilder().on(on).build());
    }

    public void setBrightness(String lightId, double brightness) {
        if (brightness < 0 || brightness > 100) {
            throw new IllegalArgumentException("Brightness must be within [0,100]: " + brightness);
        }
        updateLight(lightId, light -> light.toBuilder().brightness(brightness).build());
    }

    public synchronized void setMotionDetected(String motionZoneId, boolean motionDetected) {
        MotionZoneSnapshot zone = getExisting(motionZones, motionZoneId);
        motionZones.put(motionZoneId, zone.toBuilder().motionDetected(motionDetected).build());
        log.debug("Demo motion zone {} motion={}", motionZoneId, motionDetected);
    }

    private synchronized void updateLight(String lightId, UnaryOperator<LightSnapshot> update) {
        LightSnapshot light = getExisting(lights, lightId);
        lights.put(lightId, update.apply(light));
        log.debug("Demo light {} updated", lightId);
    }

    private static <T> T getExisting(Map<String, T> map, String id) {
        T entity = map.get(id);
        if (entity == null) {
            throw new IllegalArgumentException("Unknown demo resource '" + id + "'");
        }
        return entity;
    }
}
