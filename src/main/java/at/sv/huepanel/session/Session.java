package at.sv.huepanel.session;

import lombok.Builder;

import java.time.ZonedDateTime;

@Builder(toBuilder = true)
public record Session(String token, String bridgeAddress, String credential, ZonedDateTime createdAt,
                      ZonedDateTime expiresAt) {

    /**
     * A session is valid up to and including its expiry instant.
     */
    public boolean isExpired(ZonedDateTime now) {
        return now.isAfter(expiresAt);
    }

    public String getShortToken() {
        return shorten(token);
    }

    static String shorten(String token) {
        if (token == null) {
            return null;
        }
        return token.length() > 8 ? token.substring(0, 8) : token;
    }

    @Override
    public String toString() {
        return "Session{" +
               "token=" + getShortToken() + "..." +
               ", bridgeAddress='" + bridgeAddress + '\'' +
               ", expiresAt=" + expiresAt +
               '}';
    }
}
