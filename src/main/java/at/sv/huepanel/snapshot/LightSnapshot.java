package at.sv.huepanel.snapshot;

import lombok.Builder;

/**
 * The observable state of a single light.
 *
 * @param brightness the brightness in percent [0..100], null if the light is not dimmable
 * @param x          the CIE x coordinate, null if the light has no color support
 * @param y          the CIE y coordinate, null if the light has no color support
 * @param mirek      the color temperature in mirek, null if not in color temperature mode
 */
@Builder(toBuilder = true)
public record LightSnapshot(String id, String name, String roomId, boolean on, Double brightness, Double x, Double y,
                            Integer mirek, boolean reachable) {
}
