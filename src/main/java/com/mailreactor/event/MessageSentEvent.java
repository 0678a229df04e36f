package com.mailreactor.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Published after the outbound server accepted a message
 */
@Value
public class MessageSentEvent {

    String accountEmail;
    String messageId;
    String subject;
    List<String> recipients;
    Instant sentAt;
}
