package at.sv.huepanel.snapshot;

import lombok.Builder;

/**
 * @param lastChanged the time of the last motion report as sent by the bridge, may be null
 */
@Builder(toBuilder = true)
public record MotionZoneSnapshot(String id, String name, boolean motionDetected, boolean enabled, boolean reachable,
                                 String lastChanged) {
}
