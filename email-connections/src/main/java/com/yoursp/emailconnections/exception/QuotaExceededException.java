package com.yoursp.emailconnections.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class QuotaExceededException extends ConnectionException {

    private static final String RETRY_AFTER_SECONDS = "3600";

    public QuotaExceededException(String quotaType, Integer limit) {
        super(HttpStatus.TOO_MANY_REQUESTS,
                "EMAIL_QUOTA_EXCEEDED",
                "Email API " + quotaType + " quota exceeded",
                capitalize(quotaType) + " email API limit reached.",
                RecoveryAction.RETRY,
                "Quota type: " + quotaType + ", Limit: " + limit,
                Map.of("Retry-After", RETRY_AFTER_SECONDS),
                null);
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "Daily";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
