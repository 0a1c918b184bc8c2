package com.tempmail.util;

import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * MX lookup for forwarding targets
 */
@Slf4j
public final class DnsUtil {

    private DnsUtil() {}

    /**
     * Mail exchangers of a domain, lowest preference first.
     * Falls back to the domain itself (implicit MX) when it publishes none; empty for a blank domain.
     */
    public static List<String> lookupMx(String domain) {
        if (domain == null || domain.isBlank()) {
            return List.of();
        }
        String name = domain.trim().toLowerCase(Locale.ROOT);

        List<String> mxHosts = new ArrayList<>();
        try {
            Record[] records = new Lookup(name, Type.MX).run();
            if (records != null) {
                Arrays.stream(records)
                        .filter(MXRecord.class::isInstance)
                        .map(MXRecord.class::cast)
                        .sorted(Comparator.comparingInt(MXRecord::getPriority))
                        .map(mx -> mx.getTarget().toString(true))
                        .forEach(mxHosts::add);
            }
        } catch (TextParseException e) {
            log.warn("Invalid forward domain '{}': {}", name, e.getMessage());
            return List.of();
        }

        if (mxHosts.isEmpty()) {
            log.debug("No MX records for {}, using the domain itself", name);
            mxHosts.add(name);
        }
        return mxHosts;
    }
}
