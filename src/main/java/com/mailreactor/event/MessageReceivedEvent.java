package com.mailreactor.event;

import com.mailreactor.domain.MessageSummary;
import lombok.Value;

/**
 * Published by the mailbox monitor for every message that arrived since its last poll
 */
@Value
public class MessageReceivedEvent {

    String accountEmail;
    MessageSummary message;
}
