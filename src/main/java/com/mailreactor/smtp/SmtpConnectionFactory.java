package com.mailreactor.smtp;

import com.mailreactor.domain.AccountCredentials;
import jakarta.mail.MessagingException;

/**
 * Opens authenticated SMTP submission connections
 */
public interface SmtpConnectionFactory {

    SmtpConnection open(AccountCredentials credentials) throws MessagingException;
}
