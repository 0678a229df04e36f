package com.mailreactor.util;

import com.mailreactor.config.GatewayProperties;
import com.mailreactor.domain.SecretType;
import com.mailreactor.domain.ServerEndpoint;
import com.mailreactor.domain.TlsMode;

import java.util.Properties;

/**
 * Jakarta Mail session properties for IMAP and SMTP endpoints
 */
public final class MailSessions {

    private MailSessions() {}

    public static Properties imapProperties(ServerEndpoint endpoint, SecretType secretType,
                                            GatewayProperties.Timeouts timeouts) {
        return properties("imap", endpoint, secretType, timeouts);
    }

    public static Properties smtpProperties(ServerEndpoint endpoint, SecretType secretType,
                                            GatewayProperties.Timeouts timeouts) {
        Properties props = properties("smtp", endpoint, secretType, timeouts);
        props.put("mail.smtp.auth", "true");
        return props;
    }

    private static Properties properties(String protocol, ServerEndpoint endpoint, SecretType secretType,
                                         GatewayProperties.Timeouts timeouts) {
        String prefix = "mail." + protocol + ".";
        Properties props = new Properties();
        props.put("mail.mime.charset", "UTF-8");
        props.put(prefix + "host", endpoint.getHost());
        props.put(prefix + "port", String.valueOf(endpoint.getPort()));
        props.put(prefix + "connectiontimeout", String.valueOf(timeouts.getConnectionTimeoutMs()));
        props.put(prefix + "timeout", String.valueOf(timeouts.getReadTimeoutMs()));
        props.put(prefix + "writetimeout", String.valueOf(timeouts.getWriteTimeoutMs()));

        if (endpoint.getTls() == TlsMode.SSL) {
            props.put(prefix + "ssl.enable", "true");
            props.put(prefix + "ssl.checkserveridentity", "true");
        } else if (endpoint.getTls() == TlsMode.STARTTLS) {
            props.put(prefix + "starttls.enable", "true");
            props.put(prefix + "starttls.required", "true");
            props.put(prefix + "ssl.checkserveridentity", "true");
        }

        if (secretType == SecretType.OAUTH2_TOKEN) {
            props.put(prefix + "auth.mechanisms", "XOAUTH2");
            props.put(prefix + "auth.login.disable", "true");
            props.put(prefix + "auth.plain.disable", "true");
        }
        return props;
    }
}
