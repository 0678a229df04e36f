package com.mailreactor.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Connection parameters of a mail provider, IMAP and SMTP independently.
 * Derived data: looked up by domain, never stored beyond a lookup table.
 */
@Value
@Builder(toBuilder = true)
public class ProviderProfile {

    public static final String CUSTOM_ID = "custom";

    /** Returned when the domain is not known; the caller must supply explicit settings. */
    public static final ProviderProfile UNRESOLVED = ProviderProfile.builder().id("unresolved").build();

    String id;
    ServerEndpoint imap;
    ServerEndpoint smtp;

    public boolean isResolved() {
        return imap != null && smtp != null;
    }

    /**
     * Fill the endpoints missing from this profile with the ones of {@code fallback}.
     */
    public ProviderProfile orElse(ProviderProfile fallback) {
        if (fallback == null || isResolved()) {
            return this;
        }
        return ProviderProfile.builder()
                .id(imap == null && smtp == null ? fallback.getId() : CUSTOM_ID)
                .imap(imap != null ? imap : fallback.getImap())
                .smtp(smtp != null ? smtp : fallback.getSmtp())
                .build();
    }
}
