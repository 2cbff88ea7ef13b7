package at.sv.huepanel.session;

import java.time.Duration;

public record SessionStats(int activeSessions, Duration oldestSessionAge, Duration newestSessionAge) {
}
