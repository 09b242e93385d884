package com.sparta.farmshare.common.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 발신자 정보 (app.mail)
 */
@ConfigurationProperties(prefix = "app.mail")
public record MailProperties(
        String fromAddress,
        String fromName
) {
}
