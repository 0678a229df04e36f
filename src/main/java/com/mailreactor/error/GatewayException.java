package com.mailreactor.error;

import lombok.Getter;

import java.time.Duration;

/**
 * Classified gateway failure.
 * Carries no protocol cause: the message is already redacted and safe to show.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final GatewayErrorKind kind;
    private final String accountEmail;

    public GatewayException(GatewayErrorKind kind, String accountEmail, String message) {
        super(message);
        this.kind = kind;
        this.accountEmail = accountEmail;
    }

    public static GatewayException noSuchAccount(String email) {
        return new GatewayException(GatewayErrorKind.NOT_FOUND, email, "No such account: " + email);
    }

    public static GatewayException timeout(String email, Duration limit) {
        return new GatewayException(GatewayErrorKind.TIMEOUT, email,
                "Operation for " + email + " did not complete within " + limit.toMillis() + "ms");
    }

    public static GatewayException configuration(String email, String message) {
        return new GatewayException(GatewayErrorKind.CONFIGURATION, email, message);
    }
}
