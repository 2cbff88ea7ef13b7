package at.sv.huepanel.server;

import at.sv.huepanel.push.PushMessages;
import at.sv.huepanel.push.PushService;
import at.sv.huepanel.push.PushStats;
import at.sv.huepanel.session.SessionRegistry;
import at.sv.huepanel.session.SessionStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.websocket.WsConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Web server exposing the push socket and the diagnostics endpoint.
 */
@Slf4j
public final class PanelServer {

    public static final String SOCKET_PATH = "/api/v1/ws";
    public static final String STATS_PATH = "/api/v1/ws/stats";
    private static final Duration SOCKET_IDLE_TIMEOUT = Duration.ofMinutes(5);

    private final PushService pushService;
    private final SessionRegistry sessionRegistry;
    private final ObjectMapper mapper;
    private final Map<String, JavalinClientChannel> channels;
    private final Javalin app;

    public PanelServer(PushService pushService, SessionRegistry sessionRegistry) {
        this.pushService = pushService;
        this.sessionRegistry = sessionRegistry;
        mapper = PushMessages.createObjectMapper();
        channels = new ConcurrentHashMap<>();
        app = createApp();
    }

    private Javalin createApp() {
        Javalin javalin = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jetty.modifyWebSocketServletFactory(factory -> factory.setIdleTimeout(SOCKET_IDLE_TIMEOUT));
        });
        javalin.ws(SOCKET_PATH, this::configureSocket);
        javalin.get(STATS_PATH, this::stats);
        javalin.exception(Exception.class, (e, ctx) -> {
            log.error("Request failed: {}", ctx.path(), e);
            ctx.status(500).contentType("application/json").result("{\"error\":\"Internal server error\"}");
        });
        return javalin;
    }

    private void configureSocket(WsConfig ws) {
        ws.onConnect(ctx -> {
            JavalinClientChannel channel = new JavalinClientChannel(ctx);
            channels.put(ctx.sessionId(), channel);
            pushService.onOpen(channel);
        });
        ws.onMessage(ctx -> {
            JavalinClientChannel channel = channels.get(ctx.sessionId());
            if (channel != null) {
                pushService.onMessage(channel, ctx.message());
            }
        });
        ws.onClose(ctx -> {
            JavalinClientChannel channel = channels.remove(ctx.sessionId());
            if (channel != null) {
                channel.markClosed();
                pushService.onClose(channel, ctx.status(), ctx.reason());
            }
        });
        ws.onError(ctx -> {
            JavalinClientChannel channel = channels.get(ctx.sessionId());
            if (channel != null) {
                Throwable error = ctx.error();
                pushService.onError(channel, error != null ? error : new IllegalStateException("Unknown socket error"));
            }
        });
    }

    private void stats(Context ctx) throws JsonProcessingException {
        PushStats push = pushService.getStats();
        SessionStats sessions = sessionRegistry.getStats();
        StatsResponse response = new StatsResponse(push, new SessionSummary(sessions.activeSessions(),
                sessions.oldestSessionAge().toSeconds(), sessions.newestSessionAge().toSeconds()));
        ctx.contentType("application/json").result(mapper.writeValueAsString(response));
    }

    public void start(int port) {
        app.start(port);
        log.info("Hue panel server listening on port {} (socket {})", app.port(), SOCKET_PATH);
    }

    public void stop() {
        app.stop();
        log.info("Hue panel server stopped");
    }

    /**
     * @return the underlying Javalin instance, e.g. for testing
     */
    public Javalin app() {
        return app;
    }

    record StatsResponse(PushStats push, SessionSummary sessions) {
    }

    record SessionSummary(int activeSessions, long oldestSessionAgeSeconds, long newestSessionAgeSeconds) {
    }
}
