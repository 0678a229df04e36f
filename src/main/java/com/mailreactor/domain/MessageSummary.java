package com.mailreactor.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * API-facing envelope of a fetched message.
 * The uid is only meaningful within its folder and the current session.
 */
@Value
@Builder
public class MessageSummary {

    long uid;
    String folder;
    String messageId;
    String subject;
    String from;
    @Builder.Default
    List<String> to = List.of();
    @Builder.Default
    List<String> cc = List.of();
    Instant sentDate;
    Instant receivedDate;
    @Singular
    Set<String> flags;
    boolean seen;
    int size;
}
