package com.sparta.farmshare.infrastructure.external.google;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Google userinfo 응답
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleProfile(
        @JsonProperty("sub") String id,
        String email,
        @JsonProperty("email_verified") boolean emailVerified,
        String name,
        String picture
) {
}
