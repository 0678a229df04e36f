package com.mailreactor.config;

import com.mailreactor.domain.ProviderProfile;
import com.mailreactor.imap.ImapConnectionFactory;
import com.mailreactor.imap.JakartaImapConnectionFactory;
import com.mailreactor.provider.KnownProviders;
import com.mailreactor.provider.MxProviderLookup;
import com.mailreactor.provider.ProviderProfileResolver;
import com.mailreactor.session.SessionPool;
import com.mailreactor.smtp.JakartaSmtpConnectionFactory;
import com.mailreactor.smtp.SmtpConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.Map;

/**
 * Gateway core wiring: protocol clients, session pool and provider table
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class GatewayConfig {

    private final GatewayProperties properties;

    @Bean
    public ImapConnectionFactory imapConnectionFactory() {
        return new JakartaImapConnectionFactory(properties.getImap());
    }

    @Bean
    public SmtpConnectionFactory smtpConnectionFactory() {
        return new JakartaSmtpConnectionFactory(properties.getSmtp());
    }

    @Bean(destroyMethod = "shutdown")
    public SessionPool sessionPool(ImapConnectionFactory imapConnectionFactory,
                                   SmtpConnectionFactory smtpConnectionFactory) {
        GatewayProperties.Reconnect reconnect = properties.getReconnect();
        log.info("Session pool: {} connect attempt(s), backoff {}..{}ms",
                reconnect.getMaxAttempts(), reconnect.getBaseDelayMs(), reconnect.getMaxDelayMs());
        return new SessionPool(imapConnectionFactory, smtpConnectionFactory, reconnect.toPolicy());
    }

    @Bean
    public ProviderProfileResolver providerProfileResolver() {
        Map<String, ProviderProfile> table = KnownProviders.byDomain();
        properties.getProviders().forEach((domain, entry) -> {
            String key = domain.toLowerCase(Locale.ROOT);
            table.put(key, entry.toProfile(key));
            log.info("Provider profile for {} configured: IMAP {}:{}, SMTP {}:{}",
                    key, entry.getImapHost(), entry.getImapPort(), entry.getSmtpHost(), entry.getSmtpPort());
        });
        return new ProviderProfileResolver(table);
    }

    @Bean
    public MxProviderLookup mxProviderLookup() {
        return new MxProviderLookup();
    }
}
