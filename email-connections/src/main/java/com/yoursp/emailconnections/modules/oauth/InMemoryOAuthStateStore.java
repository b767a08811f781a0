package com.yoursp.emailconnections.modules.oauth;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import com.yoursp.emailconnections.modules.oauth.dto.OAuthStatePayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process state store. Only suitable for one application instance; use
 * {@link RedisOAuthStateStore} when running more than one.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "email-connections.state-store", havingValue = "memory", matchIfMissing = true)
public class InMemoryOAuthStateStore implements OAuthStateStore {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final Map<String, OAuthStatePayload> states = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryOAuthStateStore(EmailConnectionProperties properties, Clock clock) {
        this.clock = clock;
        this.ttl = properties.getStateTtl();
    }

    @Override
    public String generate(Long userId, String redirectUri) {
        String state = OAuthStateStore.newStateToken(SECURE_RANDOM);
        Instant now = clock.instant();
        states.put(state, new OAuthStatePayload(userId, redirectUri, now, now.plus(ttl)));
        log.debug("Generated OAuth state for user {}", userId);
        return state;
    }

    @Override
    public Optional<OAuthStatePayload> validateAndPeek(String state) {
        if (state == null || state.isBlank()) {
            return Optional.empty();
        }
        OAuthStatePayload payload = states.get(state);
        if (payload == null) {
            return Optional.empty();
        }
        if (payload.isExpired(clock.instant())) {
            states.remove(state, payload);
            return Optional.empty();
        }
        return Optional.of(payload);
    }

    @Override
    public boolean consume(String state) {
        return state != null && states.remove(state) != null;
    }

    @Override
    @Scheduled(fixedDelayString = "${email-connections.state-ttl:PT10M}")
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = states.size();
        states.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int purged = before - states.size();
        if (purged > 0) {
            log.debug("Purged {} expired OAuth state(s)", purged);
        }
        return purged;
    }
}
