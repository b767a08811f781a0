package com.yoursp.emailconnections.modules.oauth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.emailconnections.config.EmailConnectionProperties;
import com.yoursp.emailconnections.modules.oauth.dto.OAuthStatePayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;

/**
 * Manages OAuth state parameters in Redis.
 * <ul>
 * <li>Each state is stored with the configured TTL; Redis expires it</li>
 * <li>Consumption is atomic via Lua script (GET + DEL in one round-trip)</li>
 * <li>Each state can only be consumed once, so replays are rejected</li>
 * </ul>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "email-connections.state-store", havingValue = "redis")
public class RedisOAuthStateStore implements OAuthStateStore {

    static final String KEY_PREFIX = "email_oauth_state:";

    private static final String CONSUME_LUA_SCRIPT = "local val = redis.call('GET', KEYS[1]) " +
            "if val then redis.call('DEL', KEYS[1]) end " +
            "return val";

    private static final DefaultRedisScript<String> CONSUME_SCRIPT = new DefaultRedisScript<>(CONSUME_LUA_SCRIPT,
            String.class);

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;

    public RedisOAuthStateStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
            EmailConnectionProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = properties.getStateTtl();
    }

    @Override
    public String generate(Long userId, String redirectUri) {
        String state = OAuthStateStore.newStateToken(SECURE_RANDOM);
        Instant now = clock.instant();
        OAuthStatePayload payload = new OAuthStatePayload(userId, redirectUri, now, now.plus(ttl));

        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + state, objectMapper.writeValueAsString(payload), ttl);
            log.debug("Generated OAuth state for user {}", userId);
            return state;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state payload", e);
        }
    }

    @Override
    public Optional<OAuthStatePayload> validateAndPeek(String state) {
        if (state == null || state.isBlank()) {
            return Optional.empty();
        }

        String json = redisTemplate.opsForValue().get(KEY_PREFIX + state);
        if (json == null) {
            log.warn("OAuth state not found or expired");
            return Optional.empty();
        }

        OAuthStatePayload payload = parse(json);
        if (payload.isExpired(clock.instant())) {
            redisTemplate.delete(KEY_PREFIX + state);
            return Optional.empty();
        }
        return Optional.of(payload);
    }

    @Override
    public boolean consume(String state) {
        if (state == null || state.isBlank()) {
            return false;
        }
        // Atomic GET + DEL; null when the key is gone or another caller won
        Object result = redisTemplate.execute(CONSUME_SCRIPT, Collections.singletonList(KEY_PREFIX + state));
        return result != null;
    }

    private OAuthStatePayload parse(String json) {
        try {
            return objectMapper.readValue(json, OAuthStatePayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize state payload", e);
        }
    }
}
