package at.sv.huepanel.session;

import lombok.Getter;

/**
 * Signals that a session token can't be used. Callers should treat both reasons the same, the reason is only
 * meant for diagnostics.
 */
@Getter
public final class InvalidSessionException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        EXPIRED
    }

    private final Reason reason;

    public InvalidSessionException(Reason reason, String token) {
        super("Invalid session '" + Session.shorten(token) + "...': " + reason);
        this.reason = reason;
    }
}
