package com.yoursp.emailconnections.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks credentials in log messages.
 * <ul>
 * <li>Bearer / access_token / refresh_token / id_token: first 8 chars + "..."</li>
 * <li>authorization code: first 8 chars + "..."</li>
 * <li>client_secret and encryption secret: "[REDACTED]"</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.emailconnections.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // access_token=<value>, "refresh_token":"<value>", id_token: <value>
    private static final Pattern TOKEN_PATTERN = Pattern
            .compile("((?:access|refresh|id)_token[\"=:]+\\s*[\"']?)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    private static final Pattern CODE_PATTERN = Pattern
            .compile("(\\bcode[\"=:]+\\s*[\"']?)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    private static final Pattern SECRET_PATTERN = Pattern
            .compile("((?:client_secret|encryption[_-]?secret)[\"=:]+\\s*[\"']?)[^\"&\\s,]+",
                    Pattern.CASE_INSENSITIVE);

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = TOKEN_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = CODE_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = SECRET_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");

        return masked;
    }
}
