package at.sv.huepanel.api.hue;

import lombok.Data;

@Data
final class ZigbeeConnectivity {
    String id;
    String status;

    boolean isUnavailable() {
        return !"connected".equals(status);
    }
}
