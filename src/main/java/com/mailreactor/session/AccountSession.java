package com.mailreactor.session;

import com.mailreactor.domain.AccountCredentials;
import com.mailreactor.error.GatewayErrorKind;
import com.mailreactor.error.GatewayException;
import com.mailreactor.imap.ImapConnection;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live state of one account's IMAP connection.
 * Owned by {@link SessionPool}; never handed out directly.
 *
 * The operation lock queues callers of the same account in arrival order.
 * State, connection and generation are guarded by this object's monitor so that
 * {@link #invalidate} and {@link #close} can run while an operation holds the lock.
 */
@Slf4j
class AccountSession {

    private final String email;
    private final ReentrantLock operationLock = new ReentrantLock(true);

    private volatile AccountCredentials credentials;

    private SessionState state = SessionState.DISCONNECTED;
    private ImapConnection connection;
    /** Bumped on every invalidation; handles from older generations are stale */
    private long generation;
    private int consecutiveFailures;

    AccountSession(AccountCredentials credentials) {
        this.email = credentials.getEmail();
        this.credentials = credentials;
    }

    String getEmail() {
        return email;
    }

    AccountCredentials getCredentials() {
        return credentials;
    }

    /**
     * Wait for exclusive use of this session
     */
    void lock(Duration wait) {
        try {
            if (!operationLock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                throw GatewayException.timeout(email, wait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(GatewayErrorKind.TIMEOUT, email, "Interrupted while waiting for session of " + email);
        }
    }

    void unlock() {
        if (operationLock.isHeldByCurrentThread()) {
            operationLock.unlock();
        }
    }

    synchronized SessionState getState() {
        return state;
    }

    synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    synchronized void requireOpen() {
        if (state == SessionState.CLOSED) {
            throw new GatewayException(GatewayErrorKind.NOT_FOUND, email, "Account removed: " + email);
        }
    }

    /**
     * Adopt new credentials. A live connection opened with different ones is dropped and returned for disposal.
     */
    synchronized ImapConnection refreshCredentials(AccountCredentials latest) {
        AccountCredentials current = credentials;
        credentials = latest;
        boolean changed = !Objects.equals(current.getSecret(), latest.getSecret())
                || current.getSecretType() != latest.getSecretType()
                || !Objects.equals(current.getProfile(), latest.getProfile());
        if (changed && connection != null) {
            log.info("Credentials of {} changed, dropping current connection", email);
            return dropConnection(false);
        }
        return null;
    }

    /**
     * Drop a READY connection the server has closed meanwhile; returned for disposal
     */
    synchronized ImapConnection detachIfDropped() {
        if (state == SessionState.READY && connection != null && !connection.isConnected()) {
            log.info("IMAP connection of {} was closed by the server", email);
            return dropConnection(false);
        }
        return null;
    }

    synchronized boolean needsConnect() {
        return state == SessionState.DISCONNECTED;
    }

    /**
     * DISCONNECTED -> CONNECTING; returns the generation the new connection will belong to
     */
    synchronized long beginConnecting() {
        moveTo(SessionState.CONNECTING);
        return generation;
    }

    /**
     * CONNECTING -> READY. Returns false when the attempt was superseded by an invalidation
     * or the session was closed; the caller then disposes of the connection.
     */
    synchronized boolean connected(ImapConnection fresh, long attemptGeneration) {
        if (state != SessionState.CONNECTING || generation != attemptGeneration) {
            return false;
        }
        connection = fresh;
        consecutiveFailures = 0;
        moveTo(SessionState.READY);
        return true;
    }

    synchronized void connectFailed(long attemptGeneration) {
        if (state == SessionState.CONNECTING && generation == attemptGeneration) {
            consecutiveFailures++;
            moveTo(SessionState.DISCONNECTED);
        }
    }

    /**
     * READY -> BUSY, handing the connection to the caller holding the lock
     */
    synchronized SessionHandle checkout() {
        moveTo(SessionState.BUSY);
        return new SessionHandle(email, connection, generation, this);
    }

    /**
     * BUSY -> READY, unless the handle went stale meanwhile
     */
    synchronized void checkin(SessionHandle handle) {
        if (state == SessionState.BUSY && generation == handle.getGeneration()) {
            moveTo(SessionState.READY);
        }
    }

    /**
     * Force DISCONNECTED and count a failure.
     *
     * @param expectedGeneration only invalidate while still in this generation; negative for any
     * @return the dropped connection, to be disposed of by the caller
     */
    synchronized ImapConnection invalidate(long expectedGeneration) {
        if (state == SessionState.CLOSED || (expectedGeneration >= 0 && expectedGeneration != generation)) {
            return null;
        }
        consecutiveFailures++;
        if (state == SessionState.DISCONNECTED) {
            return null;
        }
        return dropConnection(true);
    }

    /**
     * Terminal transition; returns the connection to dispose of
     */
    synchronized ImapConnection close() {
        if (state == SessionState.CLOSED) {
            return null;
        }
        generation++;
        moveTo(SessionState.CLOSED);
        ImapConnection dropped = connection;
        connection = null;
        return dropped;
    }

    private ImapConnection dropConnection(boolean failure) {
        generation++;
        ImapConnection dropped = connection;
        connection = null;
        if (state != SessionState.DISCONNECTED) {
            moveTo(SessionState.DISCONNECTED);
        }
        if (failure) {
            log.warn("Session of {} invalidated (generation {})", email, generation);
        }
        return dropped;
    }

    private void moveTo(SessionState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Session of " + email + " cannot move from " + state + " to " + next);
        }
        log.debug("Session {}: {} -> {}", email, state, next);
        state = next;
    }
}
