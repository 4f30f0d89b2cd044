package com.gatehouse.api.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth2 password-flow token response.
 */
public record AccessToken(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType) {

    public static final String BEARER = "bearer";

    public static AccessToken bearer(String token) {
        return new AccessToken(token, BEARER);
    }
}
