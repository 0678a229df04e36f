package com.mailreactor.domain;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Outgoing message. Either structured fields or a raw RFC 822 payload.
 * Bcc recipients are part of the envelope only, never of the headers.
 */
@Value
@Builder
public class ComposedMessage {

    /** Defaults to the account email when null */
    String from;
    @Builder.Default
    List<String> to = List.of();
    @Builder.Default
    List<String> cc = List.of();
    @Builder.Default
    List<String> bcc = List.of();
    String subject;
    String textBody;
    String htmlBody;
    /** Complete RFC 822 message sent as-is */
    String rawMessage;

    public boolean isRaw() {
        return rawMessage != null && !rawMessage.isBlank();
    }

    public List<String> allRecipients() {
        List<String> recipients = new ArrayList<>();
        for (List<String> group : List.of(nullToEmpty(to), nullToEmpty(cc), nullToEmpty(bcc))) {
            recipients.addAll(group);
        }
        return recipients;
    }

    private static List<String> nullToEmpty(List<String> addresses) {
        return addresses != null ? addresses : List.of();
    }
}
