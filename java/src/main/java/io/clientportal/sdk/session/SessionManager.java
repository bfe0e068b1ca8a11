package io.clientportal.sdk.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.clientportal.sdk.AuthenticationRequiredException;
import io.clientportal.sdk.ClientPortalException;
import io.clientportal.sdk.Config;
import io.clientportal.sdk.ReauthenticationFailedException;
import io.clientportal.sdk.transport.GatewayTransport;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Owns the authentication state of one gateway session. Construct a single instance per gateway and share it with
 * every adapter; all methods are thread-safe.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Caches the last auth status and re-checks it at most once per {@code authCheckInterval}. Concurrent callers that
 *       find the cache stale queue on the session lock; only the first one talks to the gateway.</li>
 *   <li>A 401 from the status endpoint triggers exactly one call to {@code /iserver/reauthenticate} followed by exactly one
 *       retry of the status check. A second failure surfaces as {@link ReauthenticationFailedException}.</li>
 *   <li>After the first successful check a keep-alive task pings {@code /tickle} every {@code keepAliveInterval}. Ping
 *       failures are logged and never invalidate the cache.</li>
 *   <li>{@link #logout()} stops the keep-alive task and waits for it to finish before contacting {@code /logout}, so no
 *       ping is sent after it returns. The wait is not cut short by an interrupt.</li>
 * </ul>
 */
public final class SessionManager implements SessionGuard, AutoCloseable {

    static final String AUTH_STATUS_PATH = "/iserver/auth/status";
    static final String REAUTHENTICATE_PATH = "/iserver/reauthenticate";
    static final String TICKLE_PATH = "/tickle";
    static final String LOGOUT_PATH = "/logout";

    private static final Logger LOGGER = Logger.getLogger(SessionManager.class.getName());
    private static final Duration KEEP_ALIVE_STOP_TIMEOUT = Duration.ofSeconds(30);

    private final GatewayTransport transport;
    private final Duration authCheckInterval;
    private final Duration keepAliveInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile AuthStatus cached;
    private Instant lastCheckedAt;
    private volatile ScheduledExecutorService keepAlive;

    public SessionManager(GatewayTransport transport, Config config) {
        this(
            transport,
            Objects.requireNonNull(config, "config").getAuthCheckInterval(),
            config.getKeepAliveInterval()
        );
    }

    public SessionManager(GatewayTransport transport, Duration authCheckInterval, Duration keepAliveInterval) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.authCheckInterval = authCheckInterval == null || authCheckInterval.isNegative() || authCheckInterval.isZero()
            ? Config.DEFAULT_AUTH_CHECK_INTERVAL : authCheckInterval;
        this.keepAliveInterval = keepAliveInterval == null || keepAliveInterval.isNegative() || keepAliveInterval.isZero()
            ? Config.DEFAULT_KEEP_ALIVE_INTERVAL : keepAliveInterval;
    }

    @Override
    public void ensureLive() throws ClientPortalException {
        if (isFresh(cached)) {
            return;
        }

        lock.lock();
        try {
            // another caller may have completed the check while we were waiting
            if (isFresh(cached)) {
                return;
            }
            checkAuthStatusLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queries the auth status endpoint regardless of the cache age.
     *
     * @return the freshly cached status.
     * @throws AuthenticationRequiredException  when the gateway reports the session as unauthenticated.
     * @throws ReauthenticationFailedException  when a 401 could not be recovered through one reauthentication.
     * @throws ClientPortalException            for transport failures ({@link io.clientportal.sdk.ServerErrorException},
     *                                          {@link io.clientportal.sdk.NetworkException}, ...).
     */
    public AuthStatus checkAuthStatus() throws ClientPortalException {
        lock.lock();
        try {
            return checkAuthStatusLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Asks the gateway to restore the brokerage session without a full login.
     *
     * @throws ReauthenticationFailedException when the call fails for any reason.
     */
    public void reauthenticate() throws ReauthenticationFailedException {
        lock.lock();
        try {
            reauthenticateLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ensures the session is live and returns the cached auth payload, which may be up to {@code authCheckInterval} old.
     */
    @Override
    public Map<String, Object> sessionInfo() throws ClientPortalException {
        ensureLive();
        AuthStatus status = cached;
        return status == null ? Map.of() : status.raw();
    }

    public Optional<AuthStatus> cachedStatus() {
        return Optional.ofNullable(cached);
    }

    public boolean isKeepAliveRunning() {
        ScheduledExecutorService executor = keepAlive;
        return executor != null && !executor.isShutdown();
    }

    /**
     * Stops the keep-alive task, ends the gateway session and clears the cached status. Idempotent and never throws:
     * failures of the logout endpoint are logged.
     *
     * <p>
     * The session lock is only held while the cache is cleared, so callers of {@link #ensureLive()} are not blocked by a
     * slow gateway. A caller that re-checks the session while logout is in progress starts a new keep-alive task.
     * An interrupt received while waiting for the keep-alive task is restored once {@code /logout} has been sent.
     * </p>
     */
    @Override
    public void logout() {
        ScheduledExecutorService executor;
        lock.lock();
        try {
            cached = null;
            executor = keepAlive;
            keepAlive = null;
        } finally {
            lock.unlock();
        }

        boolean interrupted = stopKeepAlive(executor);
        try {
            transport.post(LOGOUT_PATH);
            LOGGER.info(() -> "[clientportal-sdk] session logged out");
        } catch (ClientPortalException | RuntimeException ex) {
            LOGGER.warning(() -> "[clientportal-sdk] logout failed: " + ex.getMessage());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        logout();
    }

    private boolean isFresh(AuthStatus status) {
        if (status == null) {
            return false;
        }
        Duration age = Duration.between(status.checkedAt(), Instant.now());
        return age.compareTo(authCheckInterval) <= 0;
    }

    private AuthStatus checkAuthStatusLocked() throws ClientPortalException {
        boolean reauthenticated = false;
        AuthStatus status;
        try {
            status = fetchAuthStatus();
        } catch (AuthenticationRequiredException ex) {
            cached = null;
            LOGGER.info(() -> "[clientportal-sdk] auth status rejected with 401; attempting to reauthenticate");
            reauthenticateLocked();
            reauthenticated = true;
            try {
                status = fetchAuthStatus();
            } catch (AuthenticationRequiredException retryEx) {
                throw new ReauthenticationFailedException(
                    "Session still unauthenticated after reauthentication. Manual login required.", retryEx);
            }
        }

        if (!status.authenticated()) {
            cached = null;
            AuthStatus rejected = status;
            LOGGER.warning(() -> "[clientportal-sdk] session not authenticated: " + rejected.raw());
            if (reauthenticated) {
                throw new ReauthenticationFailedException(
                    "Session still unauthenticated after reauthentication. Manual login required.");
            }
            throw new AuthenticationRequiredException("Session not authenticated. Please log in through the gateway.");
        }

        AuthStatus accepted = status;
        if (lastCheckedAt != null && lastCheckedAt.isAfter(accepted.checkedAt())) {
            accepted = accepted.withCheckedAt(lastCheckedAt);
        }
        lastCheckedAt = accepted.checkedAt();
        cached = accepted;
        startKeepAliveLocked();

        AuthStatus logged = accepted;
        LOGGER.fine(() -> "[clientportal-sdk] auth status: " + logged.raw());
        return accepted;
    }

    private AuthStatus fetchAuthStatus() throws ClientPortalException {
        JsonNode payload = transport.post(AUTH_STATUS_PATH);
        return AuthStatus.from(payload, Instant.now());
    }

    private void reauthenticateLocked() throws ReauthenticationFailedException {
        JsonNode result;
        try {
            result = transport.post(REAUTHENTICATE_PATH);
        } catch (ClientPortalException ex) {
            LOGGER.warning(() -> "[clientportal-sdk] reauthentication failed: " + ex.getMessage());
            throw new ReauthenticationFailedException("Reauthentication failed. Manual login required.", ex);
        }
        LOGGER.info(() -> "[clientportal-sdk] reauthentication result: " + result);
    }

    private void startKeepAliveLocked() {
        if (isKeepAliveRunning()) {
            return;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "clientportal-keep-alive");
            thread.setDaemon(true);
            return thread;
        });
        long periodMillis = keepAliveInterval.toMillis();
        executor.scheduleWithFixedDelay(this::tickle, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        keepAlive = executor;
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[clientportal-sdk] keep-alive started (every %d ms)", periodMillis));
    }

    // Waits for the task to finish even when interrupted; returns whether an interrupt was swallowed.
    private static boolean stopKeepAlive(ScheduledExecutorService executor) {
        if (executor == null) {
            return false;
        }
        executor.shutdownNow();
        boolean interrupted = Thread.interrupted();
        long deadline = System.nanoTime() + KEEP_ALIVE_STOP_TIMEOUT.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                LOGGER.warning(() -> "[clientportal-sdk] keep-alive task did not stop within " + KEEP_ALIVE_STOP_TIMEOUT);
                return interrupted;
            }
            try {
                if (executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    LOGGER.info(() -> "[clientportal-sdk] keep-alive stopped");
                    return interrupted;
                }
            } catch (InterruptedException ex) {
                interrupted = true;
            }
        }
    }

    // Runs on the keep-alive thread. Must not throw, or the executor suppresses later runs.
    private void tickle() {
        if (Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            transport.post(TICKLE_PATH);
            LOGGER.fine(() -> "[clientportal-sdk] keep-alive tickle sent");
        } catch (ClientPortalException ex) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.fine(() -> "[clientportal-sdk] keep-alive tickle cancelled");
                return;
            }
            LOGGER.warning(() -> "[clientportal-sdk] keep-alive tickle failed: " + ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "[clientportal-sdk] keep-alive tickle failed", ex);
        }
    }
}
