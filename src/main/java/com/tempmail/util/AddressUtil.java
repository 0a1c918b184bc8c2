package com.tempmail.util;

import com.tempmail.domain.EnvelopeRecipient;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Address resolution for inbound mail.
 * None of these methods throw: unusable input yields "".
 */
@Slf4j
public final class AddressUtil {

    private static final String ADDR_CHARS = "[^\\s<>()\\[\\]\\\\,;:\"@]+";
    private static final Pattern BARE_ADDRESS = Pattern.compile(ADDR_CHARS + "@" + ADDR_CHARS);
    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<\\s*(" + ADDR_CHARS + "@" + ADDR_CHARS + ")\\s*>");

    private AddressUtil() {}

    /**
     * Extract the bare address from free-form header text ("Name <a@b>", "<a@b>", "a@b (comment)")
     */
    public static String extractEmail(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String text = raw.trim();

        try {
            InternetAddress[] parsed = InternetAddress.parseHeader(text, false);
            if (parsed.length > 0 && parsed[0].getAddress() != null) {
                String candidate = parsed[0].getAddress().trim();
                if (BARE_ADDRESS.matcher(candidate).matches()) {
                    return candidate;
                }
            }
        } catch (AddressException e) {
            log.debug("Header address not RFC 822 compliant, falling back to pattern scan: {}", text);
        }

        Matcher angle = ANGLE_ADDRESS.matcher(text);
        if (angle.find()) {
            return angle.group(1);
        }
        Matcher bare = BARE_ADDRESS.matcher(text);
        return bare.find() ? bare.group() : "";
    }

    /**
     * Pick the recipient text: envelope first, "To" header otherwise
     */
    public static String resolveRecipient(EnvelopeRecipient envelope, String toHeader) {
        String primary = envelope != null ? envelope.primary() : "";
        if (!primary.isEmpty()) {
            return primary;
        }
        return toHeader == null ? "" : toHeader.trim();
    }

    /**
     * Lowercase bare address of the resolved recipient
     */
    public static String canonicalRecipient(EnvelopeRecipient envelope, String toHeader) {
        return extractEmail(resolveRecipient(envelope, toHeader)).toLowerCase(Locale.ROOT);
    }

    /**
     * Recipient list as recorded with the message
     */
    public static String joinRecipients(EnvelopeRecipient envelope, String fallback) {
        if (envelope != null && envelope.kind() != EnvelopeRecipient.Kind.ABSENT) {
            return envelope.joined();
        }
        return fallback == null ? "" : fallback;
    }

    /**
     * Lowercase part before '@', "" when there is none
     */
    public static String localPart(String address) {
        if (address == null) {
            return "";
        }
        int at = address.indexOf('@');
        return at > 0 ? address.substring(0, at).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Lowercase part after the last '@', "" when there is none
     */
    public static String domain(String address) {
        if (address == null) {
            return "";
        }
        int at = address.lastIndexOf('@');
        return at >= 0 ? address.substring(at + 1).trim().toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Strip angle brackets (<>) from an SMTP path
     */
    public static String stripAngleBrackets(String email) {
        if (email == null) return "";
        String stripped = email.trim();
        if (stripped.startsWith("<")) stripped = stripped.substring(1);
        if (stripped.endsWith(">")) stripped = stripped.substring(0, stripped.length() - 1);
        return stripped.trim();
    }
}
