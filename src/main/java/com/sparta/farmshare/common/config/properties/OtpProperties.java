package com.sparta.farmshare.common.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 회원가입 OTP 설정 (app.otp)
 */
@ConfigurationProperties(prefix = "app.otp")
public record OtpProperties(
        Duration ttl,
        int length,
        String hmacSecret
) {
}
