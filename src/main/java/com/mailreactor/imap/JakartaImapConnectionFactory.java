package com.mailreactor.imap;

import com.mailreactor.config.GatewayProperties;
import com.mailreactor.domain.AccountCredentials;
import com.mailreactor.domain.ServerEndpoint;
import com.mailreactor.util.MailSessions;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.imap.IMAPStore;

/**
 * IMAP connections over Jakarta Mail (Eclipse Angus)
 */
@Slf4j
@RequiredArgsConstructor
public class JakartaImapConnectionFactory implements ImapConnectionFactory {

    private final GatewayProperties.Timeouts timeouts;

    @Override
    public ImapConnection open(AccountCredentials credentials) throws MessagingException {
        ServerEndpoint endpoint = credentials.getProfile().getImap();
        Session session = Session.getInstance(
                MailSessions.imapProperties(endpoint, credentials.getSecretType(), timeouts));
        IMAPStore store = (IMAPStore) session.getStore("imap");

        log.debug("Connecting IMAP {}:{} ({}) for {}",
                endpoint.getHost(), endpoint.getPort(), endpoint.getTls(), credentials.getEmail());
        store.connect(endpoint.getHost(), endpoint.getPort(), credentials.getEmail(), credentials.getSecret());
        return new JakartaImapConnection(store);
    }
}
