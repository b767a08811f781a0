package com.yoursp.emailconnections.modules.oauth;

import com.yoursp.emailconnections.modules.oauth.dto.OAuthStatePayload;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Short-lived, single-use store of OAuth state tokens.
 * <p>
 * A state is peeked while the callback is processed and consumed once the
 * connection has been stored, so a failed exchange can be retried within the
 * TTL while a completed flow can never be replayed.
 * </p>
 */
public interface OAuthStateStore {

    /**
     * Creates and stores a new state token (at least 256 bits of entropy,
     * URL-safe).
     */
    String generate(Long userId, String redirectUri);

    /**
     * @return the payload if the state exists and has not expired; expired
     *         entries are evicted as a side effect
     */
    Optional<OAuthStatePayload> validateAndPeek(String state);

    /**
     * Atomically removes the state.
     *
     * @return true for exactly one caller per generated state
     */
    boolean consume(String state);

    /**
     * Removes expired entries. Stores whose backend expires keys on its own
     * return 0.
     */
    default int purgeExpired() {
        return 0;
    }

    static String newStateToken(SecureRandom random) {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
