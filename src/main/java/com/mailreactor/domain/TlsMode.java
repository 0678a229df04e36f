package com.mailreactor.domain;

/**
 * Transport security of an IMAP or SMTP endpoint
 */
public enum TlsMode {
    /** Implicit TLS from the first byte (IMAPS 993, SMTPS 465) */
    SSL,
    /** Plain connect, upgraded with STARTTLS before authentication */
    STARTTLS,
    /** No transport security */
    NONE
}
