package com.sparta.farmshare.common.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 관리자 가입 비밀키 (app.admin)
 */
@ConfigurationProperties(prefix = "app.admin")
public record AdminProperties(
        String secretKey
) {
}
