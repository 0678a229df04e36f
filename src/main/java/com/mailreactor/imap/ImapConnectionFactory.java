package com.mailreactor.imap;

import com.mailreactor.domain.AccountCredentials;
import jakarta.mail.MessagingException;

/**
 * Opens authenticated IMAP connections.
 * Throws {@link jakarta.mail.AuthenticationFailedException} when the credentials are rejected.
 */
public interface ImapConnectionFactory {

    ImapConnection open(AccountCredentials credentials) throws MessagingException;
}
