package com.sparta.farmshare.common.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * OTP 시도 제한, 결제 시도 제한, 웹훅 보관 기간 (app.security)
 */
@ConfigurationProperties(prefix = "app.security")
public record SecurityPolicyProperties(
        int otpMaxAttempts,
        Duration otpLockout,
        int otpAttemptsPerMinute,
        int paymentMaxInitiationsPerHour,
        int paymentMaxFailures,
        Duration paymentBlock,
        Duration webhookRetention
) {
}
