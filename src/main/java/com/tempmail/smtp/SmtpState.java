package com.tempmail.smtp;

/**
 * SMTP session state machine
 */
public enum SmtpState {
    /** Immediately after connect - waiting for EHLO/HELO */
    CONNECTED,
    /** EHLO/HELO completed - MAIL FROM allowed */
    GREETED,
    /** MAIL FROM completed - RCPT TO allowed */
    MAIL_FROM,
    /** RCPT TO completed - DATA allowed */
    RCPT_TO,
    /** Receiving DATA */
    DATA
}
