package com.tempmail.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic verification-code detection.
 * A code is a 4-8 character token of digits, or letters and digits with at least one digit,
 * found shortly after a keyword such as "code", "verify" or "OTP". Numbers without a keyword
 * (order, invoice or phone numbers) are never reported.
 */
@Slf4j
public final class VerificationCodeExtractor {

    private static final String KEYWORDS = "(?:\\b(?:verification|verify|verified|security|confirmation|login|one[- ]time)?\\s*"
            + "(?:code|passcode|otp|pin)\\b|\\bverify\\b|\\bverification\\b"
            + "|验证码|校验码|驗證碼|动态码|確認コード|認証コード|인증번호|인증 코드)";

    private static final Pattern KEYWORD_THEN_CODE = Pattern.compile(
            "(?iu)" + KEYWORDS + "[\\s\\S]{0,40}?(?<![A-Za-z0-9])((?=[A-Za-z]*[0-9])[A-Za-z0-9]{4,8})(?![A-Za-z0-9])");

    private VerificationCodeExtractor() {}

    /**
     * Scan subject, text and HTML in that order; "" when nothing plausible is found
     */
    public static String extract(String subject, String text, String html) {
        try {
            for (String source : new String[]{subject, text, EmlParser.stripHtml(html)}) {
                String code = findNearKeyword(source);
                if (!code.isEmpty()) {
                    return code;
                }
            }
        } catch (RuntimeException e) {
            log.debug("Verification code scan failed: {}", e.getMessage());
        }
        return "";
    }

    private static String findNearKeyword(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        Matcher m = KEYWORD_THEN_CODE.matcher(source);
        return m.find() ? m.group(1) : "";
    }
}
