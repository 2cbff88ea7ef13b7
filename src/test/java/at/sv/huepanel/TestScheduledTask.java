package at.sv.huepanel;

import java.time.Duration;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public final class TestScheduledTask implements ScheduledFuture<Object> {
    private final Runnable runnable;
    private final Duration delay;
    /**
     * null for one-shot tasks
     */
    private final Duration period;
    private volatile boolean cancelled;
    private int runs;

    TestScheduledTask(Runnable runnable, Duration delay, Duration period) {
        this.runnable = runnable;
        this.delay = delay;
        this.period = period;
    }

    /**
     * Runs the task once, unless it was cancelled.
     */
    public void run() {
        if (cancelled) {
            return;
        }
        runs++;
        runnable.run();
    }

    public Duration getDelay() {
        return delay;
    }

    public Duration getPeriod() {
        return period;
    }

    public int getRuns() {
        return runs;
    }

    public boolean isPeriodic() {
        return period != null;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(delay);
    }

    @Override
    public int compareTo(Delayed o) {
        return Long.compare(getDelay(TimeUnit.MILLISECONDS), o.getDelay(TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean wasCancelled = cancelled;
        cancelled = true;
        return !wasCancelled;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * One-shot tasks are done once they ran.
     */
    @Override
    public boolean isDone() {
        return cancelled || !isPeriodic() && runs > 0;
    }

    @Override
    public Object get() {
        return null;
    }

    @Override
    public Object get(long timeout, TimeUnit unit) {
        return null;
    }

    @Override
    public String toString() {
        return "TestScheduledTask{" +
               "delay=" + delay +
               ", period=" + period +
               ", cancelled=" + cancelled +
               '}';
    }
}
