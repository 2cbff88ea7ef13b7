package at.sv.huepanel.api.hue;

import java.beans.Transient;

interface Resource {
    String getId();
    Metadata getMetadata();
    String getType();

    @Transient
    default String getName() {
        Metadata metadata = getMetadata();
        if (metadata == null) {
            return null;
        }
        return metadata.getName();
    }
}
