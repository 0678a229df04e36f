package com.mailreactor.imap;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.search.SearchTerm;

import java.util.List;

/**
 * Authenticated IMAP connection of one account.
 * Not thread-safe: callers serialize access through the session pool.
 * Identifiers are UIDs of the selected folder and are only valid for this connection.
 */
public interface ImapConnection {

    /**
     * Select a folder read-only; a no-op when it is already selected
     */
    void selectFolder(String folder) throws MessagingException;

    /**
     * UIDs matching the term in the order the server returns them; every message when term is null
     */
    long[] search(SearchTerm term) throws MessagingException;

    /**
     * Envelope, flags and size for the given UIDs.
     * The result is aligned with {@code uids}; an expunged message yields a null entry.
     */
    List<Message> fetchSummaries(long[] uids) throws MessagingException;

    /**
     * Full message by UID, or null when the UID no longer exists
     */
    Message fetchMessage(long uid) throws MessagingException;

    /**
     * UIDs strictly greater than {@code uid}, ascending
     */
    long[] uidsAfter(long uid) throws MessagingException;

    /**
     * Highest UID currently in the selected folder, 0 when empty
     */
    long highestUid() throws MessagingException;

    /**
     * UIDVALIDITY of the selected folder; UIDs from a different value refer to other messages
     */
    long uidValidity() throws MessagingException;

    List<String> listFolders() throws MessagingException;

    boolean isConnected();

    /**
     * Log out and release the socket. Safe to call from another thread to abort a blocked operation.
     */
    void close();
}
