package com.mailreactor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Normalized message listing request.
 * Filters are ANDed; no filter means every message in the folder, bounded by maxResults.
 */
@Value
@Builder(toBuilder = true)
public class MessageQuery {

    public static final String INBOX = "INBOX";
    public static final int DEFAULT_MAX_RESULTS = 50;

    @Builder.Default
    String folder = INBOX;

    boolean unseenOnly;

    /** Substring of the From header */
    String from;

    /** Internal date on or after this day */
    LocalDate since;

    @Builder.Default
    int maxResults = DEFAULT_MAX_RESULTS;

    public boolean hasFilters() {
        return unseenOnly || (from != null && !from.isBlank()) || since != null;
    }
}
