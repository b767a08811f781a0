package com.yoursp.emailconnections.exception;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Redacts credential-looking fragments from free text before it is stored or
 * shown. Output is truncated to {@value #MAX_LENGTH} characters.
 */
public final class ErrorMessageSanitizer {

    public static final int MAX_LENGTH = 500;

    private static final String REDACTED = "[REDACTED]";

    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("access_token[\"\\s]*[:=][\"\\s]*[^\"\\s,&}]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("refresh_token[\"\\s]*[:=][\"\\s]*[^\"\\s,&}]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("id_token[\"\\s]*[:=][\"\\s]*[^\"\\s,&}]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("client_secret[\"\\s]*[:=][\"\\s]*[^\"\\s,&}]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("password[\"\\s]*[:=][\"\\s]*[^\"\\s,&}]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("key[\"\\s]*[:=][\"\\s]*[^\"\\s,&}]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Bearer\\s+[A-Za-z0-9_\\-./+=]+"));

    private ErrorMessageSanitizer() {
    }

    public static String sanitize(String message) {
        return sanitize(message, MAX_LENGTH);
    }

    public static String sanitize(String message, int maxLength) {
        if (message == null || message.isEmpty()) {
            return "";
        }

        String sanitized = message;
        for (Pattern pattern : SECRET_PATTERNS) {
            sanitized = pattern.matcher(sanitized).replaceAll(REDACTED);
        }

        if (sanitized.length() > maxLength) {
            sanitized = sanitized.substring(0, maxLength - 3) + "...";
        }
        return sanitized;
    }
}
