package com.mailreactor.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Full content of one message: envelope, text/HTML parts and attachment metadata
 */
@Value
@Builder
public class MessageBody {

    MessageSummary summary;
    String textBody;
    String htmlBody;
    @Singular
    List<Attachment> attachments;
}
