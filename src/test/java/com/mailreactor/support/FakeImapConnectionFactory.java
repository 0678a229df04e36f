package com.mailreactor.support;

import com.mailreactor.domain.AccountCredentials;
import com.mailreactor.imap.ImapConnection;
import com.mailreactor.imap.ImapConnectionFactory;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;

import java.net.ConnectException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * IMAP connection factory backed by in-memory mailboxes.
 * Tracks opened connections and concurrent operations per account.
 */
public class FakeImapConnectionFactory implements ImapConnectionFactory {

    private final Map<String, String> validSecrets = new ConcurrentHashMap<>();
    private final Map<String, FakeMailbox> mailboxes = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> openCount = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> connectFailures = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> maxInFlight = new ConcurrentHashMap<>();
    private final Set<String> blocked = ConcurrentHashMap.newKeySet();
    private final List<FakeImapConnection> connections = new CopyOnWriteArrayList<>();
    private final List<AccountCredentials> attempts = new CopyOnWriteArrayList<>();
    private volatile long operationDelayMs;

    /**
     * Accept {@code secret} for {@code email} and serve its mailbox
     */
    public FakeMailbox register(String email, String secret) {
        validSecrets.put(email, secret);
        return mailboxes.computeIfAbsent(email, key -> new FakeMailbox());
    }

    /**
     * Refuse the next {@code count} connection attempts of the account
     */
    public void failNextConnects(String email, int count) {
        connectFailures.computeIfAbsent(email, key -> new AtomicInteger()).set(count);
    }

    public void block(String email) {
        blocked.add(email);
    }

    public void unblock(String email) {
        blocked.remove(email);
    }

    public void setOperationDelayMs(long operationDelayMs) {
        this.operationDelayMs = operationDelayMs;
    }

    public int openCount(String email) {
        return openCount.computeIfAbsent(email, key -> new AtomicInteger()).get();
    }

    public int inFlight(String email) {
        return inFlight.computeIfAbsent(email, key -> new AtomicInteger()).get();
    }

    public int maxInFlight(String email) {
        return maxInFlight.computeIfAbsent(email, key -> new AtomicInteger()).get();
    }

    public List<FakeImapConnection> connections() {
        return connections;
    }

    /**
     * Credentials of every connection attempt, in order
     */
    public List<AccountCredentials> attempts() {
        return attempts;
    }

    @Override
    public ImapConnection open(AccountCredentials credentials) throws MessagingException {
        String email = credentials.getEmail();
        openCount.computeIfAbsent(email, key -> new AtomicInteger()).incrementAndGet();
        attempts.add(credentials);

        AtomicInteger failures = connectFailures.computeIfAbsent(email, key -> new AtomicInteger());
        if (failures.getAndUpdate(n -> Math.max(n - 1, 0)) > 0) {
            throw new MessagingException("Connection refused for " + email + " (secret=" + credentials.getSecret() + ")",
                    new ConnectException("Connection refused"));
        }
        String expected = validSecrets.get(email);
        if (expected == null || !expected.equals(credentials.getSecret())) {
            throw new AuthenticationFailedException(
                    "[AUTHENTICATIONFAILED] Invalid credentials for " + email + " using " + credentials.getSecret());
        }
        FakeImapConnection connection = new FakeImapConnection(email, mailboxes.get(email), this);
        connections.add(connection);
        return connection;
    }

    boolean isBlocked(String email) {
        return blocked.contains(email);
    }

    long operationDelayMs() {
        return operationDelayMs;
    }

    void enter(String email) {
        int current = inFlight.computeIfAbsent(email, key -> new AtomicInteger()).incrementAndGet();
        maxInFlight.computeIfAbsent(email, key -> new AtomicInteger()).accumulateAndGet(current, Math::max);
    }

    void leave(String email) {
        inFlight.get(email).decrementAndGet();
    }
}
