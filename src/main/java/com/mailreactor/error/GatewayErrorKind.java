package com.mailreactor.error;

/**
 * Closed set of error kinds surfaced by the gateway
 */
public enum GatewayErrorKind {
    /** Credentials rejected by the server */
    AUTHENTICATION("Authentication failed", true),
    /** Connection refused, reset or retries exhausted */
    CONNECTION("Connection failed", true),
    /** Operation exceeded its time budget */
    TIMEOUT("Operation timed out", true),
    /** Unknown account, folder or message */
    NOT_FOUND("Not found", false),
    /** Invalid or inconsistent settings or input */
    CONFIGURATION("Invalid configuration", false),
    /** Malformed or unexpected server response, rejected command */
    PROTOCOL("Unexpected server response", true),
    /** Anything unclassified */
    INTERNAL("Internal gateway error", false);

    private final String title;
    private final boolean invalidatesSession;

    GatewayErrorKind(String title, boolean invalidatesSession) {
        this.title = title;
        this.invalidatesSession = invalidatesSession;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Whether a failure of this kind leaves the IMAP connection in an unknown state
     */
    public boolean invalidatesSession() {
        return invalidatesSession;
    }
}
