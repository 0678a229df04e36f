package com.mailreactor.smtp;

import com.mailreactor.config.GatewayProperties;
import com.mailreactor.domain.AccountCredentials;
import com.mailreactor.domain.ServerEndpoint;
import com.mailreactor.util.MailSessions;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * SMTP submission connections over Jakarta Mail (Eclipse Angus)
 */
@Slf4j
@RequiredArgsConstructor
public class JakartaSmtpConnectionFactory implements SmtpConnectionFactory {

    private final GatewayProperties.Timeouts timeouts;

    @Override
    public SmtpConnection open(AccountCredentials credentials) throws MessagingException {
        ServerEndpoint endpoint = credentials.getProfile().getSmtp();
        Session session = Session.getInstance(
                MailSessions.smtpProperties(endpoint, credentials.getSecretType(), timeouts));
        Transport transport = session.getTransport("smtp");

        log.debug("Connecting SMTP {}:{} ({}) for {}",
                endpoint.getHost(), endpoint.getPort(), endpoint.getTls(), credentials.getEmail());
        transport.connect(endpoint.getHost(), endpoint.getPort(), credentials.getEmail(), credentials.getSecret());
        return new JakartaSmtpConnection(transport);
    }
}
