package com.tempmail.util;

import com.tempmail.domain.MailContent;
import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Content extraction from raw EML bytes, based on Jakarta Mail
 */
@Slf4j
public final class EmlParser {

    /** Upper bound for the raw-text fallback body */
    public static final int MAX_RAW_FALLBACK = 100_000;
    public static final int PREVIEW_LENGTH = 120;

    private static final Session SESSION;

    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1\\s*>");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws MessagingException, IOException {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        }
    }

    /**
     * Extract text/HTML bodies, the preview and a verification code.
     * A MIME structure that cannot be read leaves both bodies empty; a readable message without
     * any text part falls back to the start of the raw text.
     */
    public static MailContent extractContent(byte[] emlData, String subject) {
        byte[] data = emlData != null ? emlData : new byte[0];
        String text = "";
        String html = "";
        boolean parseFailed = false;

        try {
            Bodies bodies = new Bodies();
            collect(parse(data), bodies);
            text = bodies.text != null ? bodies.text : "";
            html = bodies.html != null ? bodies.html : "";
            if (text.isEmpty() && html.isEmpty()) {
                String rawText = new String(data, StandardCharsets.UTF_8);
                text = rawText.length() > MAX_RAW_FALLBACK ? rawText.substring(0, MAX_RAW_FALLBACK) : rawText;
            }
        } catch (MessagingException | IOException | RuntimeException e) {
            log.debug("MIME body unreadable, leaving bodies empty: {}", e.getMessage());
            text = "";
            html = "";
            parseFailed = true;
        }

        String preview = buildPreview(text, html);
        String code = VerificationCodeExtractor.extract(subject, text, html);
        return new MailContent(text, html, preview, code, parseFailed);
    }

    /**
     * Preview: trimmed plain text, or tag-stripped HTML, cut to 120 characters
     */
    public static String buildPreview(String text, String html) {
        String plain = text != null ? text.trim() : "";
        if (plain.isEmpty()) {
            plain = stripHtml(html);
        }
        if (plain.length() <= PREVIEW_LENGTH) {
            return plain;
        }
        int end = PREVIEW_LENGTH;
        if (Character.isHighSurrogate(plain.charAt(end - 1))) {
            end--;
        }
        return plain.substring(0, end);
    }

    /**
     * Remove tags (and script/style blocks), collapse whitespace runs
     */
    public static String stripHtml(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String noBlocks = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
        String noTags = TAG.matcher(noBlocks).replaceAll(" ");
        return WHITESPACE.matcher(noTags).replaceAll(" ").trim();
    }

    private static void collect(Part part, Bodies bodies) throws MessagingException, IOException {
        if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
            return;
        }
        if (part.isMimeType("text/plain")) {
            if (bodies.text == null) {
                bodies.text = String.valueOf(part.getContent());
            }
        } else if (part.isMimeType("text/html")) {
            if (bodies.html == null) {
                bodies.html = String.valueOf(part.getContent());
            }
        } else if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                collect(bodyPart, bodies);
            }
        } else if (part.isMimeType("message/rfc822")) {
            Object nested = part.getContent();
            if (nested instanceof Part nestedPart) {
                collect(nestedPart, bodies);
            }
        }
    }

    private static final class Bodies {
        private String text;
        private String html;
    }
}
