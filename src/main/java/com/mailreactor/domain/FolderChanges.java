package com.mailreactor.domain;

import lombok.Value;

import java.util.List;

/**
 * Messages that arrived after a cursor, with the cursor to use next time.
 * When the folder was renumbered the old UIDs mean nothing: no messages are reported
 * and the cursor restarts from the folder's current highest UID.
 */
@Value
public class FolderChanges {

    FolderCursor cursor;
    List<MessageSummary> messages;
    boolean renumbered;

    public static FolderChanges renumbered(FolderCursor restart) {
        return new FolderChanges(restart, List.of(), true);
    }
}
