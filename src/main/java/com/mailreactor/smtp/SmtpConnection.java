package com.mailreactor.smtp;

import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;

/**
 * Authenticated SMTP submission connection, used for a single send
 */
public interface SmtpConnection {

    /**
     * Hand the message to the server. Returning normally means the server accepted it for delivery.
     *
     * @throws jakarta.mail.SendFailedException when the server rejects recipients
     */
    void send(MimeMessage message, Address[] recipients) throws MessagingException;

    void close();
}
