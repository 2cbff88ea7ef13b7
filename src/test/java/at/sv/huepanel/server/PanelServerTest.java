package at.sv.huepanel.server;

import at.sv.huepanel.TaskSchedulerImpl;
import at.sv.huepanel.api.SnapshotSource;
import at.sv.huepanel.api.demo.DemoSnapshotSource;
import at.sv.huepanel.push.PushConfig;
import at.sv.huepanel.push.PushServiceImpl;
import at.sv.huepanel.session.CredentialStoreImpl;
import at.sv.huepanel.session.SessionRegistryImpl;
import at.sv.huepanel.snapshot.DiffEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PanelServerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TaskSchedulerImpl scheduler;
    private SessionRegistryImpl sessionRegistry;
    private PushServiceImpl pushService;
    private PanelServer server;
    private OkHttpClient socketClient;

    @BeforeEach
    void setUp() {
        scheduler = new TaskSchedulerImpl();
        sessionRegistry = new SessionRegistryImpl(new CredentialStoreImpl(), ZonedDateTime::now);
        PushConfig config = PushConfig.builder()
                                      .pollInterval(Duration.ofMinutes(10))
                                      .heartbeatInterval(Duration.ofMinutes(10))
                                      .heartbeatTimeout(Duration.ofMinutes(30))
                                      .build();
        pushService = new PushServiceImpl(sessionRegistry, Mockito.mock(SnapshotSource.class), new DemoSnapshotSource(),
                new DiffEngine(), scheduler, config, ZonedDateTime::now);
        server = new PanelServer(pushService, sessionRegistry);
        socketClient = new OkHttpClient();
    }

    @AfterEach
    void tearDown() {
        pushService.shutdown();
        scheduler.shutdown();
        socketClient.dispatcher().executorService().shutdown();
    }

    @Test
    void demoAuth_receivesInitialState() {
        JavalinTest.test(server.app(), (app, client) -> {
            RecordingListener listener = connect(app);

            listener.socket.send("{\"type\":\"auth\",\"demoMode\":true}");

            JsonNode initial = listener.nextMessage();
            assertThat(initial.get("type").asText()).isEqualTo("initial_state");
            assertThat(initial.get("lights")).hasSize(14);
            assertThat(initial.get("rooms")).hasSize(3);
            assertThat(initial.get("zones")).hasSize(2);
            assertThat(initial.get("motionZones")).hasSize(4);
            listener.socket.close(1000, "Done");
        });
    }

    @Test
    void clientPing_answeredWithPong() {
        JavalinTest.test(server.app(), (app, client) -> {
            RecordingListener listener = connect(app);
            listener.socket.send("{\"type\":\"auth\",\"demoMode\":true}");
            assertThat(listener.nextMessage().get("type").asText()).isEqualTo("initial_state");

            listener.socket.send("{\"type\":\"ping\"}");

            assertThat(listener.nextMessage().get("type").asText()).isEqualTo("pong");
            listener.socket.close(1000, "Done");
        });
    }

    @Test
    void invalidSession_closedWith4001() {
        JavalinTest.test(server.app(), (app, client) -> {
            RecordingListener listener = connect(app);

            listener.socket.send("{\"type\":\"auth\",\"sessionToken\":\"hue_sess_unknown\"}");

            assertThat(listener.closeCode.get(5, TimeUnit.SECONDS)).isEqualTo(4001);
            assertThat(listener.messages).isEmpty();
        });
    }

    @Test
    void stats_reportsConnectionsAndSessions() {
        sessionRegistry.createSession("192.168.0.10", "application-key");
        JavalinTest.test(server.app(), (app, client) -> {
            RecordingListener listener = connect(app);
            listener.socket.send("{\"type\":\"auth\",\"demoMode\":true}");
            listener.nextMessage();

            try (Response response = client.get(PanelServer.STATS_PATH)) {
                assertThat(response.code()).isEqualTo(200);
                JsonNode stats = MAPPER.readTree(response.body().string());
                assertThat(stats.at("/push/totalConnections").asInt()).isOne();
                assertThat(stats.at("/push/connectionsPerBridge/demo-bridge").asInt()).isOne();
                assertThat(stats.at("/push/connections/0/demo").asBoolean()).isTrue();
                assertThat(stats.at("/sessions/activeSessions").asInt()).isOne();
            }
            listener.socket.close(1000, "Done");
        });
    }

    @Test
    void clientCloses_connectionRemoved() {
        JavalinTest.test(server.app(), (app, client) -> {
            RecordingListener listener = connect(app);
            listener.socket.send("{\"type\":\"auth\",\"demoMode\":true}");
            listener.nextMessage();

            listener.socket.close(1000, "Bye");

            long deadline = System.currentTimeMillis() + 5000;
            while (pushService.getStats().totalConnections() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertThat(pushService.getStats().totalConnections()).isZero();
        });
    }

    private RecordingListener connect(Javalin app) {
        RecordingListener listener = new RecordingListener();
        Request request = new Request.Builder().url("ws://localhost:" + app.port() + PanelServer.SOCKET_PATH).build();
        listener.socket = socketClient.newWebSocket(request, listener);
        return listener;
    }

    private static final class RecordingListener extends WebSocketListener {
        private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final CompletableFuture<Integer> closeCode = new CompletableFuture<>();
        private WebSocket socket;

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            messages.add(text);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            closeCode.complete(code);
            webSocket.close(code, null);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            closeCode.completeExceptionally(t);
        }

        JsonNode nextMessage() throws Exception {
            String message = messages.poll(5, TimeUnit.SECONDS);
            assertThat(message).as("message within 5 seconds").isNotNull();
            return MAPPER.readTree(message);
        }
    }
}
