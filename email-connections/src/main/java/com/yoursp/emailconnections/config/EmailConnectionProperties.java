package com.yoursp.emailconnections.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code email-connections.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "email-connections")
public class EmailConnectionProperties {

    /** Secret the token-encryption key is derived from. Required. */
    private String encryptionSecret;

    /** Lifetime of an OAuth state entry. */
    private Duration stateTtl = Duration.ofMinutes(10);

    /** {@code memory} or {@code redis}. */
    private String stateStore = "memory";

    /** Tokens expiring within this window are refreshed proactively. */
    private Duration refreshBuffer = Duration.ofMinutes(5);

    private Google google = new Google();
    private Http http = new Http();
    private Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Google {
        private String clientId;
        private String clientSecret;
        private String authorizationUrl = "https://accounts.google.com/o/oauth2/v2/auth";
        private String tokenUrl = "https://oauth2.googleapis.com/token";
        private String userinfoUrl = "https://www.googleapis.com/oauth2/v2/userinfo";
        private String revokeUrl = "https://oauth2.googleapis.com/revoke";
        private String defaultRedirectUri;
        private List<String> defaultScopes = new ArrayList<>(List.of(
                "https://www.googleapis.com/auth/gmail.readonly",
                "https://www.googleapis.com/auth/userinfo.email",
                "https://www.googleapis.com/auth/userinfo.profile"));
    }

    @Getter
    @Setter
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Monitor {
        private boolean enabled = true;
        private Duration quickCheckInterval = Duration.ofMinutes(15);
        private Duration comprehensiveCheckInterval = Duration.ofHours(1);
        private Duration refreshSweepInterval = Duration.ofMinutes(30);
        private Duration recoveryInterval = Duration.ofHours(2);
        private String dailyMaintenanceCron = "0 0 3 * * *";
        private int quickCheckBatchSize = 20;
        private int recoveryBatchSize = 10;
        private Duration staleAfter = Duration.ofMinutes(30);
        private Duration recentWindow = Duration.ofDays(7);
        private Duration comprehensiveCheckDelay = Duration.ofMillis(100);
        private Duration oldErrorWindow = Duration.ofDays(30);
        /** Error connections untouched for this long are archived. Unset disables archival. */
        private Duration archiveAfter;
    }
}
