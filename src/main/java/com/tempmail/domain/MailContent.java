package com.tempmail.domain;

/**
 * Bodies and derived fields extracted from a raw message
 *
 * @param parseFailed true when the MIME structure could not be read and both bodies were left empty
 */
public record MailContent(String text, String html, String preview, String verificationCode, boolean parseFailed) {

    public boolean hasVerificationCode() {
        return verificationCode != null && !verificationCode.isEmpty();
    }
}
