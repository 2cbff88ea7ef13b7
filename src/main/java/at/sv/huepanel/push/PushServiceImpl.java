package at.sv.huepanel.push;

import at.sv.huepanel.TaskScheduler;
import at.sv.huepanel.api.ApiFailure;
import at.sv.huepanel.api.BridgeAuthenticationFailure;
import at.sv.huepanel.api.BridgeConnectionFailure;
import at.sv.huepanel.api.SnapshotSource;
import at.sv.huepanel.api.demo.DemoSnapshotSource;
import at.sv.huepanel.session.InvalidSessionException;
import at.sv.huepanel.session.Session;
import at.sv.huepanel.session.SessionRegistry;
import at.sv.huepanel.snapshot.Delta;
import at.sv.huepanel.snapshot.DiffEngine;
import at.sv.huepanel.snapshot.Snapshot;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

@Slf4j
public final class PushServiceImpl implements PushService {

    private final SessionRegistry sessionRegistry;
    private final SnapshotSource bridgeSource;
    private final SnapshotSource demoSource;
    private final DiffEngine diffEngine;
    private final TaskScheduler scheduler;
    private final PushConfig config;
    private final Supplier<ZonedDateTime> currentTime;
    private final PushMessages messages;
    private final Map<String, Connection> connections;
    private ScheduledFuture<?> reaperTask;

    public PushServiceImpl(SessionRegistry sessionRegistry, SnapshotSource bridgeSource, SnapshotSource demoSource,
                           DiffEngine diffEngine, TaskScheduler scheduler, PushConfig config,
                           Supplier<ZonedDateTime> currentTime) {
        this.sessionRegistry = sessionRegistry;
        this.bridgeSource = bridgeSource;
        this.demoSource = demoSource;
        this.diffEngine = diffEngine;
        this.scheduler = scheduler;
        this.config = config;
        this.currentTime = currentTime;
        messages = new PushMessages();
        connections = new ConcurrentHashMap<>();
    }

    @Override
    public void onOpen(ClientChannel channel) {
        Connection connection = new Connection(channel, currentTime.get());
        if (connections.putIfAbsent(channel.getId(), connection) != null) {
            log.error("Duplicate channel id {}", channel.getId());
            closeChannel(channel, CloseCodes.INTERNAL_ERROR, "Internal error");
            return;
        }
        log.info("Client {} connected, waiting for authentication", channel.getId());
        connection.setAuthTimeoutTask(scheduler.schedule(
                isolated(connection, "auth", () -> onAuthTimeout(connection)), config.getAuthTimeout()));
    }

    private void onAuthTimeout(Connection connection) {
        if (connection.getState() == ConnectionState.CONNECTING) {
            log.info("Client {} did not authenticate within {}", connection.getId(), config.getAuthTimeout());
            close(connection, CloseCodes.AUTHENTICATION_TIMEOUT, "Authentication timeout");
        }
    }

    @Override
    public void onMessage(ClientChannel channel, String message) {
        Connection connection = connections.get(channel.getId());
        if (connection == null) {
            log.debug("Ignoring message for unknown channel {}", channel.getId());
            return;
        }
        isolated(connection, "ws", () -> handleMessage(connection, message)).run();
    }

    private void handleMessage(Connection connection, String rawMessage) {
        InboundMessage message;
        try {
            message = messages.parse(rawMessage);
        } catch (InvalidMessageException e) {
            if (connection.getState() == ConnectionState.CONNECTING) {
                failAuthentication(connection, e.getMessage());
            } else {
                send(connection, messages.error(e.getMessage()));
            }
            return;
        }
        if (connection.getState() == ConnectionState.CONNECTING) {
            if (!message.isAuth()) {
                failAuthentication(connection, "Expected auth message");
                return;
            }
            authenticate(connection, message);
            return;
        }
        switch (message.type()) {
            case PushMessages.PONG -> connection.markPong(currentTime.get());
            case PushMessages.PING -> {
                connection.markPong(currentTime.get());
                send(connection, messages.pong());
            }
            case "auth" -> send(connection, messages.error("Already authenticated"));
            default -> send(connection, messages.error("Unknown message type '" + message.type() + "'"));
        }
    }

    private void authenticate(Connection connection, InboundMessage auth) {
        if (auth.isDemoRequested() == auth.hasSessionToken()) {
            failAuthentication(connection, "Provide either a session token or demo mode");
            return;
        }
        boolean authenticated;
        if (auth.isDemoRequested()) {
            if (!config.isDemoModeEnabled()) {
                failAuthentication(connection, "Demo mode is disabled");
                return;
            }
            authenticated = connection.authenticate(DemoSnapshotSource.DEMO_BRIDGE_ADDRESS,
                    DemoSnapshotSource.DEMO_CREDENTIAL, true, demoSource);
        } else {
            Session session;
            try {
                session = sessionRegistry.validate(auth.sessionToken());
            } catch (InvalidSessionException e) {
                log.info("Rejecting client {}: {}", connection.getId(), e.getMessage());
                failAuthentication(connection, "Invalid or expired session");
                return;
            }
            authenticated = connection.authenticate(session.bridgeAddress(), session.credential(), false,
                    bridgeSource);
        }
        if (!authenticated) {
            return;
        }
        log.info("Client {} authenticated for bridge {}", connection.getId(), connection.getBridgeAddress());
        ScheduledFuture<?> initialFetchTask = scheduler.schedule(
                isolated(connection, "fetch", () -> fetchInitialState(connection)), Duration.ZERO);
        ScheduledFuture<?> pollTask = scheduler.scheduleAtFixedRate(
                isolated(connection, "poll", () -> poll(connection)),
                config.getPollInterval(), config.getPollInterval());
        ScheduledFuture<?> heartbeatTask = scheduler.scheduleAtFixedRate(
                isolated(connection, "heartbeat", () -> heartbeat(connection)),
                config.getHeartbeatInterval(), config.getHeartbeatInterval());
        connection.startPolling(initialFetchTask, pollTask, heartbeatTask);
    }

    private void failAuthentication(Connection connection, String reason) {
        close(connection, CloseCodes.AUTHENTICATION_FAILED, "Authentication failed: " + reason);
    }

    private void fetchInitialState(Connection connection) {
        if (connection.isClosed() || !connection.tryMarkBusy()) {
            return;
        }
        try {
            publish(connection, connection.fetchSnapshot());
        } catch (BridgeConnectionFailure | BridgeAuthenticationFailure | ApiFailure e) {
            log.warn("Failed to fetch initial state of bridge {}: {}", connection.getBridgeAddress(), e.getMessage());
            send(connection, messages.error("Failed to fetch initial state"));
        } finally {
            connection.clearBusy();
        }
    }

    private void poll(Connection connection) {
        if (connection.isClosed()) {
            return;
        }
        if (!connection.tryMarkBusy()) {
            log.trace("Previous poll of {} still running, skipping", connection.getId());
            return;
        }
        try {
            publish(connection, connection.fetchSnapshot());
        } catch (BridgeConnectionFailure | BridgeAuthenticationFailure | ApiFailure e) {
            log.warn("Failed to poll bridge {}: {}. Retrying in {}", connection.getBridgeAddress(), e.getMessage(),
                    config.getPollInterval());
        } finally {
            connection.clearBusy();
        }
    }

    /**
     * Sends the full state if nothing was sent yet, the changes against the last sent state otherwise. Results for
     * closed connections are dropped.
     */
    private void publish(Connection connection, Snapshot current) {
        if (connection.isClosed()) {
            log.debug("Discarding snapshot for closed connection {}", connection.getId());
            return;
        }
        Snapshot previous = connection.getLastSnapshot();
        connection.setLastSnapshot(current);
        if (previous == null) {
            send(connection, messages.initialState(current));
            log.debug("Sent initial state {}", current);
        } else {
            Delta delta = diffEngine.diff(previous, current);
            if (!delta.isEmpty()) {
                messages.updates(delta).forEach(message -> send(connection, message));
                log.debug("Sent {} changes", delta.size());
            }
        }
    }

    /**
     * Closes the connection instead of queueing more messages for a client that does not read anymore.
     */
    private void send(Connection connection, String message) {
        int pending = connection.getPendingMessages();
        if (pending >= config.getMaxPendingMessages()) {
            log.warn("Client {} is not reading, {} messages pending", connection.getId(), pending);
            close(connection, CloseCodes.INTERNAL_ERROR, "Client too slow");
            return;
        }
        connection.send(message);
    }

    private void heartbeat(Connection connection) {
        if (connection.isClosed()) {
            return;
        }
        ZonedDateTime now = currentTime.get();
        if (connection.getTimeSinceLastPong(now).compareTo(config.getHeartbeatTimeout()) > 0) {
            log.info("No heartbeat from client {} for {}", connection.getId(), connection.getTimeSinceLastPong(now));
            close(connection, CloseCodes.HEARTBEAT_TIMEOUT, "Heartbeat timeout");
            return;
        }
        send(connection, messages.ping());
    }

    @Override
    public void onClose(ClientChannel channel, int code, String reason) {
        Connection connection = connections.get(channel.getId());
        if (connection == null) {
            return;
        }
        log.info("Client {} disconnected ({} {})", channel.getId(), code, reason);
        teardown(connection);
    }

    @Override
    public void onError(ClientChannel channel, Throwable error) {
        Connection connection = connections.get(channel.getId());
        if (connection == null) {
            return;
        }
        log.warn("Socket error for client {}: {}", channel.getId(), error.getMessage());
        close(connection, CloseCodes.INTERNAL_ERROR, "Internal error");
    }

    private void close(Connection connection, int code, String reason) {
        if (teardown(connection)) {
            closeChannel(connection.getChannel(), code, reason);
        }
    }

    /**
     * Cancels the connection's timers and removes it from the registry. Only the first call for a connection has
     * an effect.
     *
     * @return true if this call performed the teardown
     */
    private boolean teardown(Connection connection) {
        if (!connection.beginClosing()) {
            return false;
        }
        connections.remove(connection.getId(), connection);
        connection.markClosed();
        log.debug("Removed connection {}, {} remaining", connection.getId(), connections.size());
        return true;
    }

    private static void closeChannel(ClientChannel channel, int code, String reason) {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close(code, reason);
        } catch (Exception e) {
            log.warn("Failed to close channel {}: {}", channel.getId(), e.getMessage());
        }
    }

    private Runnable isolated(Connection connection, String context, Runnable task) {
        return () -> {
            MDC.put("context", context + " " + connection.getId());
            try {
                task.run();
            } catch (Exception e) {
                log.error("Unexpected error for {}: {}", connection, e.getLocalizedMessage(), e);
                close(connection, CloseCodes.INTERNAL_ERROR, "Internal error");
            } finally {
                MDC.remove("context");
            }
        };
    }

    /**
     * Removes connections whose channel is gone without a close callback and connections that are still waiting for
     * authentication after the auth timeout.
     *
     * @return the number of removed connections
     */
    int reapOrphans() {
        ZonedDateTime now = currentTime.get();
        int removed = 0;
        for (Connection connection : connections.values()) {
            if (connection.isClosed()) {
                if (connections.remove(connection.getId(), connection)) {
                    log.debug("Removed stale closed connection {}", connection.getId());
                    removed++;
                }
            } else if (!connection.getChannel().isOpen()) {
                if (teardown(connection)) {
                    removed++;
                }
            } else if (connection.getState() == ConnectionState.CONNECTING &&
                       connection.getCreatedAt().plus(config.getAuthTimeout()).isBefore(now)) {
                if (teardown(connection)) {
                    closeChannel(connection.getChannel(), CloseCodes.AUTHENTICATION_TIMEOUT, "Authentication timeout");
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Reaped {} orphaned connections", removed);
        }
        return removed;
    }

    @Override
    public PushStats getStats() {
        ZonedDateTime now = currentTime.get();
        Map<String, Integer> perBridge = new TreeMap<>();
        List<ConnectionInfo> infos = new ArrayList<>();
        for (Connection connection : connections.values()) {
            ConnectionInfo info = connection.toInfo(now);
            infos.add(info);
            if (info.bridgeAddress() != null) {
                perBridge.merge(info.bridgeAddress(), 1, Integer::sum);
            }
        }
        return new PushStats(infos.size(), perBridge, infos);
    }

    @Override
    public synchronized void start() {
        if (reaperTask != null) {
            return;
        }
        reaperTask = scheduler.scheduleAtFixedRate(this::reapWithContext, config.getCleanupInterval(),
                config.getCleanupInterval());
        log.info("Push service started: {}", config);
    }

    private void reapWithContext() {
        MDC.put("context", "reaper");
        try {
            reapOrphans();
        } finally {
            MDC.remove("context");
        }
    }

    @Override
    public synchronized void shutdown() {
        if (reaperTask != null) {
            reaperTask.cancel(false);
            reaperTask = null;
        }
        int count = 0;
        for (Connection connection : connections.values()) {
            close(connection, CloseCodes.GOING_AWAY, "Server shutting down");
            count++;
        }
        log.info("Push service stopped, closed {} connections", count);
    }
}
