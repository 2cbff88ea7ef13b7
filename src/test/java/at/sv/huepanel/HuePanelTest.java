package at.sv.huepanel;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class HuePanelTest {

    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new HuePanel());
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void invalidPollInterval_rejected() {
        assertThat(execute("--poll-interval", "0")).isEqualTo(2);
        assertThat(err.toString()).contains("--poll-interval must be > 0");
    }

    @Test
    void heartbeatTimeoutShorterThanInterval_rejected() {
        assertThat(execute("--heartbeat-interval", "30", "--heartbeat-timeout", "10")).isEqualTo(2);
        assertThat(err.toString()).contains("--heartbeat-timeout must be >= --heartbeat-interval");
    }

    @Test
    void invalidPort_rejected() {
        assertThat(execute("--port", "70000")).isEqualTo(2);
    }

    @Test
    void invalidMaxConcurrentRequests_rejected() {
        assertThat(execute("--max-concurrent-requests", "0")).isEqualTo(2);
        assertThat(err.toString()).contains("--max-concurrent-requests must be > 0");
    }

    @Test
    void invalidMaxPendingMessages_rejected() {
        assertThat(execute("--max-pending-messages", "0")).isEqualTo(2);
        assertThat(err.toString()).contains("--max-pending-messages must be > 0");
    }
}
