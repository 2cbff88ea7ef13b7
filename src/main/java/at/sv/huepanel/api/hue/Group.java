package at.sv.huepanel.api.hue;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A room or a zone. The children of a room are the devices located in it (or lights directly, for some third party
 * devices), zones usually reference lights directly.
 */
@Data
final class Group implements Resource {
    String id;
    Metadata metadata;
    List<ResourceReference> children = new ArrayList<>();
    String type;

    boolean containsDevice(String deviceId) {
        return children.stream().anyMatch(child -> child.isDevice() && child.getRid().equals(deviceId));
    }

    boolean containsLight(String lightId) {
        return children.stream().anyMatch(child -> child.isLight() && child.getRid().equals(lightId));
    }
}
