package com.yoursp.emailconnections.modules.oauth.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Account identity as returned by the provider's user-info endpoint. Also kept
 * on the connection row as {@code oauth_data}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderIdentity(
        @JsonProperty("id") String id,
        @JsonProperty("email") String email,
        @JsonProperty("verified_email") Boolean verifiedEmail,
        @JsonProperty("name") String name,
        @JsonProperty("given_name") String givenName,
        @JsonProperty("family_name") String familyName,
        @JsonProperty("picture") String picture,
        @JsonProperty("locale") String locale,
        @JsonProperty("hd") String hostedDomain) {
}
