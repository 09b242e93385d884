package com.sparta.farmshare.common.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Paystack API 연동 설정 (app.paystack)
 * 재시도 횟수 / 간격은 PaystackClient의 @Retryable 표현식에서도 같은 키를 읽는다
 */
@ConfigurationProperties(prefix = "app.paystack")
public record PaystackProperties(
        String baseUrl,
        String secretKey,
        String callbackUrl,
        Duration timeout,
        int maxRetries,
        int bankListMaxRetries,
        long retryDelayMs
) {
    public boolean isConfigured() {
        return StringUtils.hasText(secretKey);
    }
}
