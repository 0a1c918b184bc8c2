package com.tempmail.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Archive object keys: YYYY/MM/DD/safe-mailbox/HHMMSS-id.eml (UTC)
 */
public final class ObjectKeyUtil {

    private static final DateTimeFormatter DAY_PATH_FMT = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("HHmmss");

    private ObjectKeyUtil() {}

    public static String buildObjectKey(String mailbox) {
        return buildObjectKey(mailbox, Instant.now(), uniqueId());
    }

    public static String buildObjectKey(String mailbox, Instant now, String uniqueId) {
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        return utc.format(DAY_PATH_FMT) + "/" + sanitizeMailbox(mailbox) + "/"
                + utc.format(TIME_FMT) + "-" + uniqueId + ".eml";
    }

    /**
     * Lowercase, every character outside [a-z0-9@._-] replaced by '_'; "unknown" when blank
     */
    public static String sanitizeMailbox(String mailbox) {
        String value = mailbox == null || mailbox.isBlank() ? "unknown" : mailbox;
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9@._-]", "_");
    }

    /**
     * Random UUID; timestamp plus random suffix when no secure random source is usable
     */
    public static String uniqueId() {
        try {
            return UUID.randomUUID().toString();
        } catch (RuntimeException e) {
            long suffix = ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE;
            return System.currentTimeMillis() + "-" + Long.toString(suffix, 36);
        }
    }
}
