package at.sv.huepanel;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timers fire on a single scheduler thread and hand the actual work to a worker pool, so a slow task (e.g. a
 * bridge request) never delays the timers of other tasks.
 */
@Slf4j
public final class TaskSchedulerImpl implements TaskScheduler {

    private final ScheduledExecutorService scheduler;
    private final ExecutorService executor;

    public TaskSchedulerImpl() {
        this(Executors.newSingleThreadScheduledExecutor(namedThreads("scheduler")),
                Executors.newCachedThreadPool(namedThreads("worker")));
    }

    public TaskSchedulerImpl(ScheduledExecutorService scheduler, ExecutorService executor) {
        this.scheduler = scheduler;
        this.executor = executor;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable runnable, Duration delay) {
        return scheduler.schedule(() -> executor.submit(logUncaughtException(runnable)),
                delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable runnable, Duration initialDelay, Duration period) {
        return scheduler.scheduleAtFixedRate(() -> executor.submit(logUncaughtException(runnable)),
                initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void shutdown() {
        scheduler.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Runnable logUncaughtException(Runnable runnable) {
        return () -> {
            try {
                runnable.run();
            } catch (Exception e) {
                log.error("Uncaught exception: {}", e.getLocalizedMessage(), e);
            } finally {
                MDC.clear();
            }
        };
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
