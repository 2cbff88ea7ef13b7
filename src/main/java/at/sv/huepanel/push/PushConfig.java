package at.sv.huepanel.push;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Builder(toBuilder = true)
@Getter
@ToString
public final class PushConfig {
    @Builder.Default
    private final Duration authTimeout = Duration.ofSeconds(10);
    @Builder.Default
    private final Duration pollInterval = Duration.ofSeconds(15);
    @Builder.Default
    private final Duration heartbeatInterval = Duration.ofSeconds(30);
    /**
     * A connection without a pong for longer than this is considered dead.
     */
    @Builder.Default
    private final Duration heartbeatTimeout = Duration.ofSeconds(90);
    /**
     * Interval of the orphan reaper.
     */
    @Builder.Default
    private final Duration cleanupInterval = Duration.ofSeconds(60);
    /**
     * A connection with more unsent messages than this is closed, its client is not reading anymore.
     */
    @Builder.Default
    private final int maxPendingMessages = 32;
    @Builder.Default
    private final boolean demoModeEnabled = true;

    public static PushConfig defaults() {
        return PushConfig.builder().build();
    }
}
