package com.mailreactor.provider;

import com.mailreactor.domain.ProviderProfile;
import com.mailreactor.util.DnsUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Detects the hosting provider of a custom domain from its MX records
 */
@Slf4j
public class MxProviderLookup {

    private final Function<String, List<String>> mxResolver;

    public MxProviderLookup() {
        this(DnsUtil::lookupMx);
    }

    public MxProviderLookup(Function<String, List<String>> mxResolver) {
        this.mxResolver = mxResolver;
    }

    public Optional<ProviderProfile> detect(String domain) {
        if (domain == null || domain.isBlank()) {
            return Optional.empty();
        }
        for (String mxHost : mxResolver.apply(domain)) {
            Optional<ProviderProfile> profile = KnownProviders.byMxHost(mxHost);
            if (profile.isPresent()) {
                log.info("Domain {} is hosted by {} (MX {})", domain, profile.get().getId(), mxHost);
                return profile;
            }
        }
        log.debug("No known provider behind MX records of {}", domain);
        return Optional.empty();
    }
}
