package at.sv.huepanel.api.hue;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.Optional;

/**
 * An automation configured on the bridge. MotionAware zones are behavior instances whose motion service refers to
 * a {@code convenience_area_motion} resource; the behavior carries the name, the motion area the status.
 */
@Data
final class BehaviorInstance implements Resource {
    String id;
    Metadata metadata;
    boolean enabled;
    JsonNode configuration;
    String type;

    Optional<String> getConvenienceAreaMotionId() {
        if (configuration == null) {
            return Optional.empty();
        }
        JsonNode motionService = configuration.path("motion").path("motion_service");
        if (!"convenience_area_motion".equals(motionService.path("rtype").asText(null))) {
            return Optional.empty();
        }
        return Optional.ofNullable(motionService.path("rid").asText(null));
    }
}
