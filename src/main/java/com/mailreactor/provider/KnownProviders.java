package com.mailreactor.provider;

import com.mailreactor.domain.ProviderProfile;
import com.mailreactor.domain.ServerEndpoint;
import com.mailreactor.domain.TlsMode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in table of well-known mail providers and their documented endpoints
 */
public final class KnownProviders {

    private static final Map<String, ProviderProfile> PROFILES = new LinkedHashMap<>();
    private static final Map<String, ProviderProfile> DOMAINS = new LinkedHashMap<>();
    /** MX host suffix -> provider id, for custom domains hosted by a known provider */
    private static final Map<String, String> MX_SUFFIXES = new LinkedHashMap<>();

    static {
        register("gmail", "imap.gmail.com", 993, TlsMode.SSL, "smtp.gmail.com", 587, TlsMode.STARTTLS,
                List.of("gmail.com", "googlemail.com"));
        register("outlook", "outlook.office365.com", 993, TlsMode.SSL, "smtp.office365.com", 587, TlsMode.STARTTLS,
                List.of("outlook.com", "hotmail.com", "live.com", "msn.com"));
        register("yahoo", "imap.mail.yahoo.com", 993, TlsMode.SSL, "smtp.mail.yahoo.com", 465, TlsMode.SSL,
                List.of("yahoo.com", "ymail.com"));
        register("icloud", "imap.mail.me.com", 993, TlsMode.SSL, "smtp.mail.me.com", 587, TlsMode.STARTTLS,
                List.of("icloud.com", "me.com", "mac.com"));
        register("aol", "imap.aol.com", 993, TlsMode.SSL, "smtp.aol.com", 465, TlsMode.SSL,
                List.of("aol.com"));
        register("fastmail", "imap.fastmail.com", 993, TlsMode.SSL, "smtp.fastmail.com", 465, TlsMode.SSL,
                List.of("fastmail.com", "fastmail.fm"));
        register("zoho", "imap.zoho.com", 993, TlsMode.SSL, "smtp.zoho.com", 465, TlsMode.SSL,
                List.of("zoho.com", "zohomail.com"));
        register("gmx", "imap.gmx.com", 993, TlsMode.SSL, "mail.gmx.com", 587, TlsMode.STARTTLS,
                List.of("gmx.com"));
        register("qq", "imap.qq.com", 993, TlsMode.SSL, "smtp.qq.com", 465, TlsMode.SSL,
                List.of("qq.com"));
        register("netease", "imap.163.com", 993, TlsMode.SSL, "smtp.163.com", 465, TlsMode.SSL,
                List.of("163.com"));

        MX_SUFFIXES.put("google.com", "gmail");
        MX_SUFFIXES.put("googlemail.com", "gmail");
        MX_SUFFIXES.put("outlook.com", "outlook");
        MX_SUFFIXES.put("yahoodns.net", "yahoo");
        MX_SUFFIXES.put("icloud.com", "icloud");
        MX_SUFFIXES.put("messagingengine.com", "fastmail");
        MX_SUFFIXES.put("zoho.com", "zoho");
    }

    private KnownProviders() {}

    /**
     * Domain -> profile table; a copy the caller may extend
     */
    public static Map<String, ProviderProfile> byDomain() {
        return new LinkedHashMap<>(DOMAINS);
    }

    public static Optional<ProviderProfile> byId(String id) {
        return Optional.ofNullable(PROFILES.get(id));
    }

    /**
     * Provider whose mail exchangers end with a known suffix
     */
    public static Optional<ProviderProfile> byMxHost(String mxHost) {
        if (mxHost == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> entry : MX_SUFFIXES.entrySet()) {
            String suffix = entry.getKey();
            if (mxHost.equals(suffix) || mxHost.endsWith("." + suffix)) {
                return byId(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private static void register(String id, String imapHost, int imapPort, TlsMode imapTls,
                                 String smtpHost, int smtpPort, TlsMode smtpTls, List<String> domains) {
        ProviderProfile profile = ProviderProfile.builder()
                .id(id)
                .imap(ServerEndpoint.of(imapHost, imapPort, imapTls))
                .smtp(ServerEndpoint.of(smtpHost, smtpPort, smtpTls))
                .build();
        PROFILES.put(id, profile);
        domains.forEach(domain -> DOMAINS.put(domain, profile));
    }
}
