package at.sv.huepanel;

import at.sv.huepanel.api.HttpResourceProviderImpl;
import at.sv.huepanel.api.demo.DemoSnapshotSource;
import at.sv.huepanel.api.hue.HueHttpsClientFactory;
import at.sv.huepanel.api.hue.HueSnapshotSource;
import at.sv.huepanel.push.PushConfig;
import at.sv.huepanel.push.PushServiceImpl;
import at.sv.huepanel.server.PanelServer;
import at.sv.huepanel.session.CredentialStoreImpl;
import at.sv.huepanel.session.SessionRegistryImpl;
import at.sv.huepanel.snapshot.DiffEngine;
import com.github.benmanes.caffeine.cache.Ticker;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.ZonedDateTime;

@Command(name = "HuePanel", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class HuePanel implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(HuePanel.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--port", paramLabel = "<port>",
            defaultValue = "${env:PORT:-3001}",
            description = "The port of the web server. Default: ${DEFAULT-VALUE}")
    int port;
    @Option(names = "--poll-interval", paramLabel = "<seconds>",
            defaultValue = "${env:POLL_INTERVAL:-15}",
            description = "The interval in seconds in which the bridge of each connected client is polled. " +
                          "Default: ${DEFAULT-VALUE} seconds.")
    int pollIntervalInSeconds;
    @Option(names = "--heartbeat-interval", paramLabel = "<seconds>",
            defaultValue = "${env:HEARTBEAT_INTERVAL:-30}",
            description = "The interval in seconds in which clients are pinged. Default: ${DEFAULT-VALUE} seconds.")
    int heartbeatIntervalInSeconds;
    @Option(names = "--heartbeat-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:HEARTBEAT_TIMEOUT:-90}",
            description = "Clients that did not answer a ping for this many seconds are disconnected. " +
                          "Default: ${DEFAULT-VALUE} seconds.")
    int heartbeatTimeoutInSeconds;
    @Option(names = "--auth-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:AUTH_TIMEOUT:-10}",
            description = "The time in seconds a client has to authenticate after connecting. " +
                          "Default: ${DEFAULT-VALUE} seconds.")
    int authTimeoutInSeconds;
    @Option(names = "--cleanup-interval", paramLabel = "<seconds>",
            defaultValue = "${env:CLEANUP_INTERVAL:-60}",
            description = "The interval in seconds in which orphaned connections are removed. " +
                          "Default: ${DEFAULT-VALUE} seconds.")
    int cleanupIntervalInSeconds;
    @Option(names = "--session-ttl", paramLabel = "<hours>",
            defaultValue = "${env:SESSION_TTL:-24}",
            description = "The lifetime of a session in hours. Default: ${DEFAULT-VALUE} hours.")
    int sessionTtlInHours;
    @Option(names = "--session-cleanup-interval", paramLabel = "<minutes>",
            defaultValue = "${env:SESSION_CLEANUP_INTERVAL:-60}",
            description = "The interval in minutes in which expired sessions are removed. " +
                          "Default: ${DEFAULT-VALUE} minutes.")
    int sessionCleanupIntervalInMinutes;
    @Option(names = "--credentials-file", paramLabel = "<file>",
            defaultValue = "${env:CREDENTIALS_FILE:-data/bridge-credentials.json}",
            description = "The file the bridge credentials are persisted to. Default: ${DEFAULT-VALUE}")
    Path credentialsFile;
    @Option(names = "--bridge-cache-ttl", paramLabel = "<minutes>",
            defaultValue = "${env:BRIDGE_CACHE_TTL:-5}",
            description = "The time in minutes rooms, devices and behaviors of a bridge are cached. " +
                          "Default: ${DEFAULT-VALUE} minutes.")
    int bridgeCacheTtlInMinutes;
    @Option(names = "--request-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:REQUEST_TIMEOUT:-10}",
            description = "The timeout in seconds of a single bridge request. Default: ${DEFAULT-VALUE} seconds.")
    int requestTimeoutInSeconds;
    @Option(names = "--max-concurrent-requests", paramLabel = "<requests>",
            defaultValue = "${env:MAX_CONCURRENT_REQUESTS:-4}",
            description = "The maximum number of concurrent in-flight bridge requests. Default: ${DEFAULT-VALUE}")
    int maxConcurrentRequests;
    @Option(names = "--max-pending-messages", paramLabel = "<messages>",
            defaultValue = "${env:MAX_PENDING_MESSAGES:-32}",
            description = "The maximum number of unsent messages per client before the client is disconnected. " +
                          "Default: ${DEFAULT-VALUE}")
    int maxPendingMessages;
    @Option(names = "--disable-demo-mode",
            defaultValue = "${env:DISABLE_DEMO_MODE:-false}",
            description = "Reject clients that request demo mode. Default: ${DEFAULT-VALUE}")
    boolean disableDemoMode;

    public static void main(String[] args) {
        int execute = new CommandLine(new HuePanel()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        TaskScheduler scheduler = new TaskSchedulerImpl();
        SessionRegistryImpl sessionRegistry = new SessionRegistryImpl(new CredentialStoreImpl(credentialsFile),
                ZonedDateTime::now, Duration.ofHours(sessionTtlInHours));
        HueSnapshotSource bridgeSource = new HueSnapshotSource(
                new HttpResourceProviderImpl(createHttpsClient(), maxConcurrentRequests),
                Duration.ofMinutes(bridgeCacheTtlInMinutes), Ticker.systemTicker());
        PushServiceImpl pushService = new PushServiceImpl(sessionRegistry, bridgeSource, new DemoSnapshotSource(),
                new DiffEngine(), scheduler, createPushConfig(), ZonedDateTime::now);
        PanelServer server = new PanelServer(pushService, sessionRegistry);

        sessionRegistry.startCleanup(scheduler, Duration.ofMinutes(sessionCleanupIntervalInMinutes));
        pushService.start();
        server.start(port);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("context", "shutdown");
            LOG.info("Shutting down");
            pushService.shutdown();
            sessionRegistry.stopCleanup();
            server.stop();
            scheduler.shutdown();
        }));
        MDC.remove("context");
    }

    private PushConfig createPushConfig() {
        return PushConfig.builder()
                         .authTimeout(Duration.ofSeconds(authTimeoutInSeconds))
                         .pollInterval(Duration.ofSeconds(pollIntervalInSeconds))
                         .heartbeatInterval(Duration.ofSeconds(heartbeatIntervalInSeconds))
                         .heartbeatTimeout(Duration.ofSeconds(heartbeatTimeoutInSeconds))
                         .cleanupInterval(Duration.ofSeconds(cleanupIntervalInSeconds))
                         .maxPendingMessages(maxPendingMessages)
                         .demoModeEnabled(!disableDemoMode)
                         .build();
    }

    private OkHttpClient createHttpsClient() {
        try {
            return HueHttpsClientFactory.createHttpsClient(Duration.ofSeconds(requestTimeoutInSeconds));
        } catch (GeneralSecurityException e) {
            System.err.println("Failed to create https client: " + e.getLocalizedMessage());
            System.exit(1);
        }
        return null;
    }

    private void assertConfigurationParameters() {
        if (port < 0 || port > 65535) {
            fail("--port must be within [0,65535]");
        }
        if (pollIntervalInSeconds <= 0) {
            fail("--poll-interval must be > 0");
        }
        if (heartbeatIntervalInSeconds <= 0) {
            fail("--heartbeat-interval must be > 0");
        }
        if (heartbeatTimeoutInSeconds < heartbeatIntervalInSeconds) {
            fail("--heartbeat-timeout must be >= --heartbeat-interval");
        }
        if (authTimeoutInSeconds <= 0) {
            fail("--auth-timeout must be > 0");
        }
        if (cleanupIntervalInSeconds <= 0) {
            fail("--cleanup-interval must be > 0");
        }
        if (sessionTtlInHours <= 0) {
            fail("--session-ttl must be > 0");
        }
        if (sessionCleanupIntervalInMinutes <= 0) {
            fail("--session-cleanup-interval must be > 0");
        }
        if (bridgeCacheTtlInMinutes < 0) {
            fail("--bridge-cache-ttl must be >= 0");
        }
        if (requestTimeoutInSeconds <= 0) {
            fail("--request-timeout must be > 0");
        }
        if (maxConcurrentRequests <= 0) {
            fail("--max-concurrent-requests must be > 0");
        }
        if (maxPendingMessages <= 0) {
            fail("--max-pending-messages must be > 0");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
