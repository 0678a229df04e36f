package com.mailreactor.config;

import com.mailreactor.domain.ProviderProfile;
import com.mailreactor.domain.ServerEndpoint;
import com.mailreactor.domain.TlsMode;
import com.mailreactor.session.ReconnectPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mail Reactor gateway configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "mailreactor")
public class GatewayProperties {

    /** Upper bound of every facade operation, connection setup and queueing included */
    private long operationTimeoutMs = 30000L;

    private Timeouts imap = new Timeouts();
    private Timeouts smtp = new Timeouts();
    private Reconnect reconnect = new Reconnect();
    private Query query = new Query();
    private Provider provider = new Provider();
    private Monitor monitor = new Monitor();

    /**
     * Extra provider profiles keyed by domain; entries override the built-in table.
     * Dotted keys need brackets in YAML: {@code "[example.org]"}.
     */
    private Map<String, ProviderEntry> providers = new LinkedHashMap<>();

    public Duration getOperationTimeout() {
        return Duration.ofMillis(operationTimeoutMs);
    }

    @Data
    public static class Timeouts {
        private int connectionTimeoutMs = 10000;
        private int readTimeoutMs = 30000;
        private int writeTimeoutMs = 20000;
    }

    @Data
    public static class Reconnect {
        private int maxAttempts = 3;
        private long baseDelayMs = 500L;
        private long maxDelayMs = 15000L;
        private boolean jitter = true;

        public ReconnectPolicy toPolicy() {
            return new ReconnectPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitter);
        }
    }

    @Data
    public static class Query {
        private int defaultMaxResults = 50;
        private int maxResultsLimit = 500;
    }

    @Data
    public static class Provider {
        /** Match unknown domains against well-known MX hosts (DNS lookup at account-add) */
        private boolean mxLookupEnabled = false;
    }

    @Data
    public static class Monitor {
        private boolean enabled = false;
        private long intervalMs = 60000L;
        private String folder = "INBOX";
    }

    @Data
    public static class ProviderEntry {
        private String imapHost;
        private int imapPort = 993;
        private TlsMode imapTls = TlsMode.SSL;
        private String smtpHost;
        private int smtpPort = 587;
        private TlsMode smtpTls = TlsMode.STARTTLS;

        public ProviderProfile toProfile(String id) {
            return ProviderProfile.builder()
                    .id(id)
                    .imap(ServerEndpoint.of(imapHost, imapPort, imapTls))
                    .smtp(ServerEndpoint.of(smtpHost, smtpPort, smtpTls))
                    .build();
        }
    }
}
