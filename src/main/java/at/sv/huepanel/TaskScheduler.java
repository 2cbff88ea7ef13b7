package at.sv.huepanel;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

public interface TaskScheduler {
    ScheduledFuture<?> schedule(Runnable runnable, Duration delay);

    ScheduledFuture<?> scheduleAtFixedRate(Runnable runnable, Duration initialDelay, Duration period);

    void shutdown();
}
