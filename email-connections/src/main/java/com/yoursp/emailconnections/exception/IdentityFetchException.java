package com.yoursp.emailconnections.exception;

/**
 * The provider's user-info endpoint failed or returned an identity without an
 * email address. Reported to callers as a failed token exchange.
 */
public class IdentityFetchException extends OAuthTokenExchangeException {

    public IdentityFetchException(String reason, Throwable cause) {
        super("identity fetch failed: " + reason, null, cause);
    }
}
