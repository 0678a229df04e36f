package com.mailreactor.smtp;

import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SmtpConnection} backed by a connected {@link Transport}
 */
@Slf4j
public class JakartaSmtpConnection implements SmtpConnection {

    private final Transport transport;

    JakartaSmtpConnection(Transport transport) {
        this.transport = transport;
    }

    @Override
    public void send(MimeMessage message, Address[] recipients) throws MessagingException {
        transport.sendMessage(message, recipients);
    }

    @Override
    public void close() {
        try {
            transport.close();
        } catch (MessagingException e) {
            log.debug("SMTP QUIT failed: {}", e.getMessage());
        }
    }
}
