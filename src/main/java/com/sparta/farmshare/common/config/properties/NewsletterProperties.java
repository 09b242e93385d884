package com.sparta.farmshare.common.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 뉴스레터 배치 발송 설정 (app.newsletter)
 */
@ConfigurationProperties(prefix = "app.newsletter")
public record NewsletterProperties(
        int batchSize,
        Duration batchDelay
) {
}
