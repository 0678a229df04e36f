package com.mailreactor.util;

import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * DNS utilities for MX lookup
 */
@Slf4j
public final class DnsUtil {

    private DnsUtil() {}

    /**
     * Lookup MX hosts of a domain, sorted by priority, lower case, without trailing dot.
     * Empty when the domain has no MX records or the lookup fails.
     */
    public static List<String> lookupMx(String domain) {
        List<String> mxHosts = new ArrayList<>();
        try {
            Lookup lookup = new Lookup(domain, Type.MX);
            lookup.setResolver(new SimpleResolver());
            Record[] records = lookup.run();

            if (records != null) {
                List<MXRecord> mxRecords = new ArrayList<>();
                for (Record record : records) {
                    if (record instanceof MXRecord mx) {
                        mxRecords.add(mx);
                    }
                }
                mxRecords.sort(Comparator.comparingInt(MXRecord::getPriority));
                for (MXRecord mx : mxRecords) {
                    mxHosts.add(mx.getTarget().toString(true).toLowerCase(Locale.ROOT));
                }
            }
        } catch (TextParseException | UnknownHostException e) {
            log.warn("MX lookup failed for domain {}: {}", domain, e.getMessage());
        }
        return mxHosts;
    }
}
