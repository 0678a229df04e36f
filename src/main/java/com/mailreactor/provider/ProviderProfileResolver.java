package com.mailreactor.provider;

import com.mailreactor.domain.ProviderProfile;
import com.mailreactor.domain.ServerEndpoint;
import com.mailreactor.domain.TlsMode;
import com.mailreactor.error.GatewayException;
import com.mailreactor.util.MailAddressUtil;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps an email domain to provider connection parameters.
 * Stateless after construction and safe for concurrent use.
 */
public class ProviderProfileResolver {

    private static final Set<Integer> PLAINTEXT_PORTS = Set.of(25, 143, 110, 587);
    private static final Set<Integer> IMPLICIT_TLS_PORTS = Set.of(465, 993, 995);

    private final Map<String, ProviderProfile> table;

    /**
     * @param table profiles keyed by lower case domain
     */
    public ProviderProfileResolver(Map<String, ProviderProfile> table) {
        this.table = Map.copyOf(table);
    }

    /**
     * Profile of the address's domain, or {@link ProviderProfile#UNRESOLVED} when the domain is unknown
     */
    public ProviderProfile resolve(String email) {
        String domain = MailAddressUtil.extractDomain(email);
        if (domain == null) {
            return ProviderProfile.UNRESOLVED;
        }
        return table.getOrDefault(domain.toLowerCase(Locale.ROOT), ProviderProfile.UNRESOLVED);
    }

    /**
     * Complete user-supplied settings with the known profile of the domain and validate the result.
     *
     * @param explicit settings given by the caller, may be null or partial
     * @throws GatewayException CONFIGURATION when no complete profile can be formed or it is inconsistent
     */
    public ProviderProfile complete(String email, ProviderProfile explicit) {
        return complete(email, explicit, resolve(email));
    }

    /**
     * Same as {@link #complete(String, ProviderProfile)} with a fallback found elsewhere, e.g. through MX records
     */
    public ProviderProfile complete(String email, ProviderProfile explicit, ProviderProfile fallback) {
        ProviderProfile profile = explicit == null ? fallback : explicit.orElse(fallback);
        if (profile == null || !profile.isResolved()) {
            throw GatewayException.configuration(email, "No provider profile known for domain '"
                    + MailAddressUtil.extractDomain(email) + "'; IMAP and SMTP settings are required");
        }
        if (profile.getId() == null) {
            profile = profile.toBuilder().id(ProviderProfile.CUSTOM_ID).build();
        }
        validate(email, profile);
        return profile;
    }

    /**
     * Reject settings that contradict themselves, e.g. implicit TLS on a plaintext port
     */
    public void validate(String email, ProviderProfile profile) {
        validateEndpoint(email, "IMAP", profile.getImap());
        validateEndpoint(email, "SMTP", profile.getSmtp());
    }

    private void validateEndpoint(String email, String protocol, ServerEndpoint endpoint) {
        if (endpoint.getHost() == null || endpoint.getHost().isBlank()) {
            throw GatewayException.configuration(email, protocol + " host is required");
        }
        int port = endpoint.getPort();
        if (port < 1 || port > 65535) {
            throw GatewayException.configuration(email, protocol + " port out of range: " + port);
        }
        TlsMode tls = endpoint.getTls();
        if (tls == null) {
            throw GatewayException.configuration(email, protocol + " TLS mode is required");
        }
        if (tls == TlsMode.SSL && PLAINTEXT_PORTS.contains(port)) {
            throw GatewayException.configuration(email,
                    protocol + " TLS mode SSL conflicts with plaintext port " + port);
        }
        if (tls != TlsMode.SSL && IMPLICIT_TLS_PORTS.contains(port)) {
            throw GatewayException.configuration(email,
                    protocol + " TLS mode " + tls + " conflicts with implicit TLS port " + port);
        }
    }
}
