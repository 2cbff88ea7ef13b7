package at.sv.huepanel.session;

import at.sv.huepanel.TaskScheduler;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

@Slf4j
public final class SessionRegistryImpl implements SessionRegistry {

    public static final Duration DEFAULT_SESSION_LIFETIME = Duration.ofHours(24);
    private static final String TOKEN_PREFIX = "hue_sess_";
    private static final int TOKEN_BYTES = 32;

    private final CredentialStore credentialStore;
    private final Supplier<ZonedDateTime> currentTime;
    private final Duration sessionLifetime;
    private final SecureRandom random;
    private final Map<String, Session> sessions;
    private ScheduledFuture<?> cleanupTask;

    public SessionRegistryImpl(CredentialStore credentialStore, Supplier<ZonedDateTime> currentTime) {
        this(credentialStore, currentTime, DEFAULT_SESSION_LIFETIME);
    }

    public SessionRegistryImpl(CredentialStore credentialStore, Supplier<ZonedDateTime> currentTime,
                               Duration sessionLifetime) {
        this.credentialStore = credentialStore;
        this.currentTime = currentTime;
        this.sessionLifetime = sessionLifetime;
        random = new SecureRandom();
        sessions = new ConcurrentHashMap<>();
    }

    @Override
    public Session createSession(String bridgeAddress, String credential) {
        String resolvedCredential = resolveCredential(bridgeAddress, credential);
        ZonedDateTime now = currentTime.get();
        Session session = Session.builder()
                                 .token(generateUniqueToken())
                                 .bridgeAddress(bridgeAddress)
                                 .credential(resolvedCredential)
                                 .createdAt(now)
                                 .expiresAt(now.plus(sessionLifetime))
                                 .build();
        if (sessions.putIfAbsent(session.token(), session) != null) {
            throw new IllegalStateException("Session token collision");
        }
        log.info("Created session {}... for bridge {}", session.getShortToken(), bridgeAddress);
        return session;
    }

    private String resolveCredential(String bridgeAddress, String credential) {
        if (credential == null || credential.isBlank()) {
            return credentialStore.get(bridgeAddress)
                                  .orElseThrow(() -> new MissingCredentialException(bridgeAddress));
        }
        credentialStore.put(bridgeAddress, credential);
        return credential;
    }

    private String generateUniqueToken() {
        String token;
        do {
            token = generateToken();
        } while (sessions.containsKey(token));
        return token;
    }

    private String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return TOKEN_PREFIX + HexFormat.of().formatHex(bytes);
    }

    @Override
    public Session validate(String token) {
        if (token == null) {
            throw new InvalidSessionException(InvalidSessionException.Reason.NOT_FOUND, null);
        }
        Session session = sessions.get(token);
        if (session == null) {
            throw new InvalidSessionException(InvalidSessionException.Reason.NOT_FOUND, token);
        }
        if (session.isExpired(currentTime.get())) {
            sessions.remove(token, session);
            log.debug("Expired session {}...", session.getShortToken());
            throw new InvalidSessionException(InvalidSessionException.Reason.EXPIRED, token);
        }
        return session;
    }

    @Override
    public void revoke(String token) {
        if (token == null) {
            return;
        }
        Session removed = sessions.remove(token);
        if (removed != null) {
            log.info("Revoked session {}...", removed.getShortToken());
        }
    }

    /**
     * Checks and extends the session in one atomic step, so a concurrent revoke is reported as
     * {@link InvalidSessionException.Reason#NOT_FOUND}.
     */
    @Override
    public ZonedDateTime renew(String token) {
        if (token == null) {
            throw new InvalidSessionException(InvalidSessionException.Reason.NOT_FOUND, null);
        }
        ZonedDateTime now = currentTime.get();
        AtomicReference<Session> renewed = new AtomicReference<>();
        AtomicReference<InvalidSessionException.Reason> failure =
                new AtomicReference<>(InvalidSessionException.Reason.NOT_FOUND);
        sessions.computeIfPresent(token, (key, session) -> {
            if (session.isExpired(now)) {
                failure.set(InvalidSessionException.Reason.EXPIRED);
                log.debug("Expired session {}...", session.getShortToken());
                return null;
            }
            Session updated = session.toBuilder().expiresAt(now.plus(sessionLifetime)).build();
            renewed.set(updated);
            return updated;
        });
        if (renewed.get() == null) {
            throw new InvalidSessionException(failure.get(), token);
        }
        log.debug("Renewed session {}... until {}", renewed.get().getShortToken(), renewed.get().expiresAt());
        return renewed.get().expiresAt();
    }

    @Override
    public int cleanup() {
        ZonedDateTime now = currentTime.get();
        int[] removed = {0};
        sessions.values().removeIf(session -> {
            boolean expired = session.isExpired(now);
            if (expired) {
                removed[0]++;
            }
            return expired;
        });
        if (removed[0] > 0) {
            log.debug("Cleaned up {} expired session(s)", removed[0]);
        }
        return removed[0];
    }

    @Override
    public SessionStats getStats() {
        ZonedDateTime now = currentTime.get();
        Duration oldest = Duration.ZERO;
        Duration newest = null;
        for (Session session : sessions.values()) {
            Duration age = Duration.between(session.createdAt(), now);
            if (age.compareTo(oldest) > 0) {
                oldest = age;
            }
            if (newest == null || age.compareTo(newest) < 0) {
                newest = age;
            }
        }
        return new SessionStats(sessions.size(), oldest, newest == null ? Duration.ZERO : newest);
    }

    /**
     * Starts the periodic removal of expired sessions.
     */
    public synchronized void startCleanup(TaskScheduler scheduler, Duration interval) {
        if (cleanupTask != null) {
            return;
        }
        cleanupTask = scheduler.scheduleAtFixedRate(this::cleanup, interval, interval);
        log.info("Started session cleanup every {} minute(s)", interval.toMinutes());
    }

    public synchronized void stopCleanup() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
            cleanupTask = null;
            log.info("Stopped session cleanup");
        }
    }
}
