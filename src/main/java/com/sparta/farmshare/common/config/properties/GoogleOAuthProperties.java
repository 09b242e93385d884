package com.sparta.farmshare.common.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Google OAuth 클라이언트 설정 (app.oauth.google)
 */
@ConfigurationProperties(prefix = "app.oauth.google")
public record GoogleOAuthProperties(
        String clientId,
        String clientSecret,
        String callbackUrl
) {
}
