package at.sv.huepanel.push;

import at.sv.huepanel.api.SnapshotSource;
import at.sv.huepanel.snapshot.Snapshot;
import lombok.Getter;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-socket state. State transitions are guarded by the connection's monitor, reads of the state are not. Outbound
 * messages go through an ordered outbox that is written to the channel outside of the monitor by one thread at a
 * time, so a client that stops reading only blocks the thread currently flushing and never a state transition.
 */
final class Connection {

    @Getter
    private final ClientChannel channel;
    @Getter
    private final ZonedDateTime createdAt;
    private final AtomicBoolean busy = new AtomicBoolean();
    private final Queue<String> outbox = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingMessages = new AtomicInteger();
    private final AtomicBoolean flushing = new AtomicBoolean();

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile ZonedDateTime lastPong;
    @Getter
    private volatile String bridgeAddress;
    private volatile String credential;
    @Getter
    private volatile boolean demo;
    private volatile SnapshotSource snapshotSource;
    private volatile Snapshot lastSnapshot;

    private ScheduledFuture<?> authTimeoutTask;
    private ScheduledFuture<?> initialFetchTask;
    private ScheduledFuture<?> pollTask;
    private ScheduledFuture<?> heartbeatTask;

    Connection(ClientChannel channel, ZonedDateTime createdAt) {
        this.channel = channel;
        this.createdAt = createdAt;
        this.lastPong = createdAt;
    }

    String getId() {
        return channel.getId();
    }

    ConnectionState getState() {
        return state;
    }

    boolean isClosed() {
        return state.isClosed();
    }

    synchronized void setAuthTimeoutTask(ScheduledFuture<?> authTimeoutTask) {
        if (state.isClosed()) {
            authTimeoutTask.cancel(false);
            return;
        }
        this.authTimeoutTask = authTimeoutTask;
    }

    /**
     * @return false if the connection was not waiting for authentication anymore
     */
    synchronized boolean authenticate(String bridgeAddress, String credential, boolean demo,
                                      SnapshotSource snapshotSource) {
        if (state != ConnectionState.CONNECTING) {
            return false;
        }
        this.bridgeAddress = bridgeAddress;
        this.credential = credential;
        this.demo = demo;
        this.snapshotSource = snapshotSource;
        state = ConnectionState.AUTHENTICATED;
        cancel(authTimeoutTask);
        authTimeoutTask = null;
        return true;
    }

    /**
     * @return false if the connection was closed in the meantime, in which case the given tasks are cancelled
     */
    synchronized boolean startPolling(ScheduledFuture<?> initialFetchTask, ScheduledFuture<?> pollTask,
                                      ScheduledFuture<?> heartbeatTask) {
        if (state != ConnectionState.AUTHENTICATED) {
            cancel(initialFetchTask);
            cancel(pollTask);
            cancel(heartbeatTask);
            return false;
        }
        this.initialFetchTask = initialFetchTask;
        this.pollTask = pollTask;
        this.heartbeatTask = heartbeatTask;
        state = ConnectionState.POLLING;
        return true;
    }

    /**
     * Moves the connection into {@link ConnectionState#CLOSING} and cancels all of its timers.
     *
     * @return true only for the first caller, all later calls are no-ops
     */
    synchronized boolean beginClosing() {
        if (state.isClosed()) {
            return false;
        }
        state = ConnectionState.CLOSING;
        cancel(authTimeoutTask);
        cancel(initialFetchTask);
        cancel(pollTask);
        cancel(heartbeatTask);
        authTimeoutTask = null;
        initialFetchTask = null;
        pollTask = null;
        heartbeatTask = null;
        discardOutbox();
        return true;
    }

    synchronized void markClosed() {
        state = ConnectionState.CLOSED;
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * Queues the message and flushes the outbox, unless another thread is already flushing it. In that case this
     * call returns immediately and the flushing thread also writes this message.
     *
     * @return false if the message was dropped because the connection is closing
     */
    boolean send(String message) {
        if (!enqueue(message)) {
            return false;
        }
        flush();
        return true;
    }

    private synchronized boolean enqueue(String message) {
        if (state.isClosed()) {
            return false;
        }
        pendingMessages.incrementAndGet();
        outbox.add(message);
        return true;
    }

    private void flush() {
        while (!outbox.isEmpty() && flushing.compareAndSet(false, true)) {
            try {
                String message;
                while ((message = outbox.poll()) != null) {
                    pendingMessages.decrementAndGet();
                    if (state.isClosed()) {
                        discardOutbox();
                        return;
                    }
                    channel.send(message);
                }
            } finally {
                flushing.set(false);
            }
        }
    }

    private void discardOutbox() {
        while (outbox.poll() != null) {
            pendingMessages.decrementAndGet();
        }
    }

    /**
     * @return the number of queued messages not yet handed to the channel
     */
    int getPendingMessages() {
        return pendingMessages.get();
    }

    Snapshot fetchSnapshot() {
        return snapshotSource.getSnapshot(bridgeAddress, credential);
    }

    Snapshot getLastSnapshot() {
        return lastSnapshot;
    }

    void setLastSnapshot(Snapshot lastSnapshot) {
        this.lastSnapshot = lastSnapshot;
    }

    boolean tryMarkBusy() {
        return busy.compareAndSet(false, true);
    }

    void clearBusy() {
        busy.set(false);
    }

    boolean isBusy() {
        return busy.get();
    }

    void markPong(ZonedDateTime now) {
        lastPong = now;
    }

    Duration getTimeSinceLastPong(ZonedDateTime now) {
        return Duration.between(lastPong, now);
    }

    ConnectionInfo toInfo(ZonedDateTime now) {
        return new ConnectionInfo(getId(), bridgeAddress, demo, getState(),
                Duration.between(createdAt, now).toSeconds(), getTimeSinceLastPong(now).toSeconds(), isBusy(),
                getPendingMessages());
    }

    @Override
    public String toString() {
        return "Connection{" +
               "id=" + getId() +
               ", bridge=" + bridgeAddress +
               ", demo=" + demo +
               '}';
    }
}
