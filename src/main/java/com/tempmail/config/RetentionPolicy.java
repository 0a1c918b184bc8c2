package com.tempmail.config;

/**
 * How long a mailbox lives, measured from its creation time
 */
public record RetentionPolicy(int minutes) {

    public RetentionPolicy {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Retention must be at least one minute, got " + minutes);
        }
    }
}
