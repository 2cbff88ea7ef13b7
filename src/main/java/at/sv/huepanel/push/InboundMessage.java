package at.sv.huepanel.push;

/**
 * A message sent by a client. Only {@code auth} messages carry a session token or the demo flag.
 */
public record InboundMessage(String type, String sessionToken, Boolean demoMode) {

    public boolean isAuth() {
        return "auth".equals(type);
    }

    public boolean isDemoRequested() {
        return Boolean.TRUE.equals(demoMode);
    }

    public boolean hasSessionToken() {
        return sessionToken != null && !sessionToken.isBlank();
    }
}
