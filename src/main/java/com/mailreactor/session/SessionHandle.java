package com.mailreactor.session;

import com.mailreactor.imap.ImapConnection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive use of one account's IMAP connection for the duration of one operation.
 * Must be given back through {@link SessionPool#release(SessionHandle)}.
 */
public final class SessionHandle {

    private final String email;
    private final ImapConnection connection;
    private final long generation;
    private final AccountSession session;
    private final AtomicBoolean released = new AtomicBoolean(false);

    SessionHandle(String email, ImapConnection connection, long generation, AccountSession session) {
        this.email = email;
        this.connection = connection;
        this.generation = generation;
        this.session = session;
    }

    public String getEmail() {
        return email;
    }

    public ImapConnection getConnection() {
        return connection;
    }

    long getGeneration() {
        return generation;
    }

    AccountSession getSession() {
        return session;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }
}
