package at.sv.huepanel.api.hue;

import lombok.Data;

@Data
final class ConvenienceAreaMotion {
    String id;
    Boolean enabled;
    Motion motion;

    boolean isMotionDetected() {
        return motion != null && Boolean.TRUE.equals(motion.motion);
    }

    boolean isMotionValid() {
        return motion == null || !Boolean.FALSE.equals(motion.motion_valid);
    }

    boolean isEnabled() {
        return !Boolean.FALSE.equals(enabled);
    }

    String getLastChanged() {
        if (motion == null || motion.motion_report == null) {
            return null;
        }
        return motion.motion_report.changed;
    }

    @Data
    static final class Motion {
        Boolean motion;
        Boolean motion_valid;
        MotionReport motion_report;
    }

    @Data
    static final class MotionReport {
        String changed;
        Boolean motion;
    }
}
