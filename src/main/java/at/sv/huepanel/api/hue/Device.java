package at.sv.huepanel.api.hue;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
final class Device implements Resource {
    String id;
    Metadata metadata;
    List<ResourceReference> services = new ArrayList<>();
    String type;

    Optional<String> getZigbeeConnectivityResource() {
        return services.stream()
                       .filter(ResourceReference::isZigbeeConnectivity)
                       .findFirst()
                       .map(ResourceReference::getRid);
    }
}
