package com.mailreactor.domain;

import lombok.Value;

/**
 * Attachment metadata of a fetched message
 */
@Value
public class Attachment {

    String filename;
    String contentType;
    int size;
}
