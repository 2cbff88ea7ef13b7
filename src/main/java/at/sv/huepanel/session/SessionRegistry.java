package at.sv.huepanel.session;

import java.time.ZonedDateTime;

/**
 * Issues and validates opaque session tokens, each bound to a bridge address and its credential.
 */
public interface SessionRegistry {
    /**
     * Creates a new session for the given bridge. If a credential is given, it is stored for the bridge address,
     * replacing any previously stored one. If no credential is given, the stored credential of the bridge is reused.
     *
     * @param credential the application key, or null to reuse the stored one
     * @return the new session. Not null.
     * @throws MissingCredentialException if no credential is given and none is stored for the bridge
     */
    Session createSession(String bridgeAddress, String credential);

    /**
     * @return the session for the given token. Not null.
     * @throws InvalidSessionException if the token is unknown or expired. Expired sessions are removed.
     */
    Session validate(String token);

    /**
     * Removes the session. Unknown tokens are ignored.
     */
    void revoke(String token);

    /**
     * Extends the expiry of the session by the full session lifetime, starting now. The token stays the same.
     *
     * @return the new expiry
     * @throws InvalidSessionException if the token is unknown or expired
     */
    ZonedDateTime renew(String token);

    /**
     * Removes all expired sessions.
     *
     * @return the number of removed sessions
     */
    int cleanup();

    SessionStats getStats();
}
