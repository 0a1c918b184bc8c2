package com.tempmail.domain;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Envelope recipient as supplied by the inbound source: a single address, a list of addresses, or nothing.
 */
public record EnvelopeRecipient(Kind kind, List<String> addresses) {

    public enum Kind {
        SINGLE,
        MANY,
        ABSENT
    }

    private static final EnvelopeRecipient ABSENT_RECIPIENT = new EnvelopeRecipient(Kind.ABSENT, List.of());

    public EnvelopeRecipient {
        Objects.requireNonNull(kind, "kind");
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
    }

    public static EnvelopeRecipient single(String address) {
        return address == null ? ABSENT_RECIPIENT : new EnvelopeRecipient(Kind.SINGLE, List.of(address));
    }

    public static EnvelopeRecipient many(List<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            return ABSENT_RECIPIENT;
        }
        return new EnvelopeRecipient(Kind.MANY, addresses.stream().filter(Objects::nonNull).toList());
    }

    public static EnvelopeRecipient absent() {
        return ABSENT_RECIPIENT;
    }

    /**
     * First envelope address, or "" when there is none
     */
    public String primary() {
        return addresses.isEmpty() ? "" : addresses.get(0).trim();
    }

    /**
     * Non-blank envelope addresses joined by ','
     */
    public String joined() {
        return addresses.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(","));
    }
}
