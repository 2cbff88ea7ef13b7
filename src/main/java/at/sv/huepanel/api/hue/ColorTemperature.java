package at.sv.huepanel.api.hue;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
final class ColorTemperature {
    Integer mirek;
    Boolean mirek_valid;

    /**
     * The bridge reports the last known mirek even when the light is in xy mode, flagged by {@code mirek_valid}.
     */
    Integer getMirekIfValid() {
        if (Boolean.FALSE.equals(mirek_valid)) {
            return null;
        }
        return mirek;
    }
}
