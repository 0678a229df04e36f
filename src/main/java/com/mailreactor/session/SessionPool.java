package com.mailreactor.session;

import com.mailreactor.domain.AccountCredentials;
import com.mailreactor.domain.ServerEndpoint;
import com.mailreactor.error.GatewayErrorKind;
import com.mailreactor.error.GatewayException;
import com.mailreactor.imap.ImapConnection;
import com.mailreactor.imap.ImapConnectionFactory;
import com.mailreactor.smtp.SmtpConnection;
import com.mailreactor.smtp.SmtpConnectionFactory;
import com.mailreactor.util.SecretRedactor;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one IMAP session per account and serializes access to it.
 *
 * Callers of the same account queue on that account's lock; different accounts never share a lock.
 * All mutation of the email -> session map goes through acquire, release, invalidate and remove.
 */
@Slf4j
public class SessionPool {

    private final Map<String, AccountSession> sessions = new ConcurrentHashMap<>();
    private final ImapConnectionFactory imapFactory;
    private final SmtpConnectionFactory smtpFactory;
    private final ReconnectPolicy reconnectPolicy;

    public SessionPool(ImapConnectionFactory imapFactory, SmtpConnectionFactory smtpFactory,
                       ReconnectPolicy reconnectPolicy) {
        this.imapFactory = imapFactory;
        this.smtpFactory = smtpFactory;
        this.reconnectPolicy = reconnectPolicy;
    }

    /**
     * Take exclusive use of the account's session, creating it when the account has none yet.
     * Blocks behind earlier callers of the same account for at most {@code wait}.
     * Only account registration creates sessions; other callers use {@link #acquireExisting}.
     *
     * @throws AuthenticationFailedException credentials rejected, not retried
     * @throws GatewayException              CONNECTION once every attempt failed, TIMEOUT when the queue wait
     *                                       ran out, NOT_FOUND when the account was removed meanwhile
     */
    public SessionHandle acquire(AccountCredentials credentials, Duration wait) throws MessagingException {
        AccountSession session = sessions.computeIfAbsent(credentials.getEmail(), email -> {
            log.debug("Creating session for {}", email);
            return new AccountSession(credentials);
        });
        return acquire(session, credentials, wait);
    }

    /**
     * Same as {@link #acquire} for an account that already has a session.
     *
     * @throws GatewayException NOT_FOUND when the account has no session, e.g. it was removed
     */
    public SessionHandle acquireExisting(AccountCredentials credentials, Duration wait) throws MessagingException {
        AccountSession session = sessions.get(credentials.getEmail());
        if (session == null) {
            throw GatewayException.noSuchAccount(credentials.getEmail());
        }
        return acquire(session, credentials, wait);
    }

    private SessionHandle acquire(AccountSession session, AccountCredentials credentials, Duration wait)
            throws MessagingException {
        session.lock(wait);
        try {
            session.requireOpen();
            discard(session.getEmail(), session.refreshCredentials(credentials));
            discard(session.getEmail(), session.detachIfDropped());
            if (session.needsConnect()) {
                connect(session);
            }
            return session.checkout();
        } catch (MessagingException | RuntimeException e) {
            session.unlock();
            throw e;
        }
    }

    /**
     * Give the session back, letting the next queued caller of the account proceed.
     * Releasing twice is harmless.
     */
    public void release(SessionHandle handle) {
        if (handle == null || !handle.markReleased()) {
            return;
        }
        AccountSession session = handle.getSession();
        session.checkin(handle);
        session.unlock();
    }

    /**
     * Force the account's session to DISCONNECTED so the next acquire opens a fresh connection.
     * Does not wait for an in-flight operation; its connection is closed underneath it.
     */
    public void invalidate(String email) {
        AccountSession session = sessions.get(email);
        if (session != null) {
            discard(email, session.invalidate(-1));
        }
    }

    /**
     * Invalidate the connection behind a handle, unless a newer connection already replaced it
     */
    public void invalidate(SessionHandle handle) {
        discard(handle.getEmail(), handle.getSession().invalidate(handle.getGeneration()));
    }

    /**
     * Close the account's session for good and forget it.
     * Callers still queued for it fail with NOT_FOUND.
     *
     * @return whether a session existed
     */
    public boolean remove(String email) {
        AccountSession session = sessions.remove(email);
        if (session == null) {
            return false;
        }
        discard(email, session.close());
        log.info("Session of {} closed", email);
        return true;
    }

    public Optional<SessionState> stateOf(String email) {
        AccountSession session = sessions.get(email);
        return session == null ? Optional.empty() : Optional.of(session.getState());
    }

    /**
     * Open a fresh outbound connection; the caller closes it after one send
     */
    public OutboundHandle openOutbound(AccountCredentials credentials) throws MessagingException {
        SmtpConnection connection = smtpFactory.open(credentials);
        return new OutboundHandle(credentials.getEmail(), connection);
    }

    public void shutdown() {
        log.info("Closing {} account session(s)", sessions.size());
        for (String email : sessions.keySet()) {
            remove(email);
        }
    }

    private void connect(AccountSession session) throws MessagingException {
        String email = session.getEmail();
        AccountCredentials credentials = session.getCredentials();
        ServerEndpoint endpoint = credentials.getProfile().getImap();
        MessagingException lastFailure = null;

        for (int attempt = 1; attempt <= reconnectPolicy.getMaxAttempts(); attempt++) {
            backoff(email, session.getConsecutiveFailures());
            long generation = session.beginConnecting();
            ImapConnection connection;
            try {
                connection = imapFactory.open(credentials);
            } catch (AuthenticationFailedException e) {
                session.connectFailed(generation);
                log.warn("IMAP authentication failed for {}", email);
                throw e;
            } catch (MessagingException e) {
                session.connectFailed(generation);
                lastFailure = e;
                log.warn("IMAP connect attempt {}/{} for {} failed: {}", attempt, reconnectPolicy.getMaxAttempts(),
                        email, SecretRedactor.redact(e.getMessage(), credentials.getSecret()));
                continue;
            } catch (RuntimeException e) {
                session.connectFailed(generation);
                throw e;
            }

            if (!session.connected(connection, generation)) {
                discard(email, connection);
                session.requireOpen();
                throw new GatewayException(GatewayErrorKind.CONNECTION, email,
                        "Connection attempt for " + email + " was cancelled");
            }
            log.info("IMAP session ready for {} ({}:{})", email, endpoint.getHost(), endpoint.getPort());
            return;
        }

        String detail = lastFailure != null && lastFailure.getMessage() != null
                ? ": " + SecretRedactor.redact(lastFailure.getMessage(), credentials.getSecret())
                : "";
        throw new GatewayException(GatewayErrorKind.CONNECTION, email,
                "Unable to connect to " + endpoint.getHost() + ":" + endpoint.getPort() + " after "
                        + reconnectPolicy.getMaxAttempts() + " attempt(s)" + detail);
    }

    private void backoff(String email, int consecutiveFailures) {
        long delay = reconnectPolicy.delayFor(consecutiveFailures);
        if (delay <= 0) {
            return;
        }
        log.debug("Waiting {}ms before reconnecting {}", delay, email);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(GatewayErrorKind.TIMEOUT, email, "Interrupted while reconnecting " + email);
        }
    }

    /**
     * Close a dropped connection off the caller's thread; logout may block on a wedged socket
     */
    private void discard(String email, ImapConnection connection) {
        if (connection == null) {
            return;
        }
        Schedulers.boundedElastic().schedule(() -> {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Closing IMAP connection of {} failed: {}", email, e.getMessage());
            }
        });
    }
}
