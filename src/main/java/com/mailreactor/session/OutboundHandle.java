package com.mailreactor.session;

import com.mailreactor.smtp.SmtpConnection;
import lombok.extern.slf4j.Slf4j;

/**
 * One-shot SMTP connection, closed after a single send
 */
@Slf4j
public final class OutboundHandle implements AutoCloseable {

    private final String email;
    private final SmtpConnection connection;

    OutboundHandle(String email, SmtpConnection connection) {
        this.email = email;
        this.connection = connection;
    }

    public String getEmail() {
        return email;
    }

    public SmtpConnection getConnection() {
        return connection;
    }

    @Override
    public void close() {
        log.debug("Closing SMTP connection of {}", email);
        connection.close();
    }
}
