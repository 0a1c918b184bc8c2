package com.tempmail.domain;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetHeaders;
import jakarta.mail.internet.MimeUtility;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.UnsupportedEncodingException;

/**
 * One inbound message: raw RFC 822 bytes, the headers parsed from them and the envelope data.
 * Header lookup is case-insensitive.
 */
@Slf4j
@Getter
public final class InboundMail {

    private final byte[] raw;
    private final String envelopeSender;
    private final EnvelopeRecipient envelope;
    private final InternetHeaders headers;

    private InboundMail(byte[] raw, String envelopeSender, EnvelopeRecipient envelope, InternetHeaders headers) {
        this.raw = raw;
        this.envelopeSender = envelopeSender;
        this.envelope = envelope;
        this.headers = headers;
    }

    public static InboundMail of(byte[] raw, String envelopeSender, EnvelopeRecipient envelope) {
        byte[] data = raw != null ? raw : new byte[0];
        return new InboundMail(data, envelopeSender == null ? "" : envelopeSender,
                envelope != null ? envelope : EnvelopeRecipient.absent(), parseHeaders(data));
    }

    private static InternetHeaders parseHeaders(byte[] data) {
        try {
            return new InternetHeaders(new ByteArrayInputStream(data));
        } catch (MessagingException e) {
            log.debug("Unparseable header block, continuing without headers: {}", e.getMessage());
            return new InternetHeaders();
        }
    }

    /**
     * Unfolded header value, "" when absent
     */
    public String header(String name) {
        String value = headers.getHeader(name, ", ");
        return value == null ? "" : MimeUtility.unfold(value).trim();
    }

    /**
     * Subject with RFC 2047 encoded-words decoded, "" when absent
     */
    public String subject() {
        String value = header("Subject");
        try {
            return MimeUtility.decodeText(value);
        } catch (UnsupportedEncodingException e) {
            return value;
        }
    }
}
