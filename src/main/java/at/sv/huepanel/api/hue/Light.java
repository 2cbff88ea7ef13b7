package at.sv.huepanel.api.hue;

import at.sv.huepanel.snapshot.LightSnapshot;
import lombok.Data;

@Data
final class Light implements Resource {
    String id;
    ResourceReference owner;
    Metadata metadata;
    On on;
    Dimming dimming;
    ColorTemperature color_temperature;
    Color color;
    String type;

    LightSnapshot toSnapshot(String roomId, boolean reachable) {
        Integer mirek = getMirek();
        return LightSnapshot.builder()
                            .id(id)
                            .name(getName())
                            .roomId(roomId)
                            .on(isOn())
                            .brightness(getBrightness())
                            .x(mirek == null ? getX() : null)
                            .y(mirek == null ? getY() : null)
                            .mirek(mirek)
                            .reachable(reachable)
                            .build();
    }

    String getOwnerId() {
        if (owner == null) {
            return null;
        }
        return owner.getRid();
    }

    boolean isOn() {
        return on != null && on.isOn();
    }

    private Double getBrightness() {
        if (dimming == null) {
            return null;
        }
        return dimming.brightness;
    }

    private Integer getMirek() {
        if (color_temperature == null) {
            return null;
        }
        return color_temperature.getMirekIfValid();
    }

    private Double getX() {
        if (color == null || color.xy == null) {
            return null;
        }
        return color.xy.x;
    }

    private Double getY() {
        if (color == null || color.xy == null) {
            return null;
        }
        return color.xy.y;
    }

    @Data
    static final class On {
        boolean on;
    }

    @Data
    static final class Dimming {
        Double brightness;
    }
}
