package com.sparta.farmshare.common.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 프론트엔드 주소 (app.frontend)
 * url: 메일 링크용, baseUrl: OAuth 리다이렉트용
 */
@ConfigurationProperties(prefix = "app.frontend")
public record FrontendProperties(
        String url,
        String baseUrl
) {
}
