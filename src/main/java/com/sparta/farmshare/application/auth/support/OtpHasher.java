package com.sparta.farmshare.application.auth.support;

import com.sparta.farmshare.common.config.properties.OtpProperties;
import com.sparta.farmshare.common.util.HashUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * OTP 해시 (HMAC-SHA256)
 * 원문 OTP는 저장하지 않는다
 */
@Component
@RequiredArgsConstructor
public class OtpHasher {

    private final OtpProperties otpProperties;

    public String hash(String code) {
        return HashUtils.hmacSha256Hex(otpProperties.hmacSecret(), code);
    }

    public boolean matches(String rawCode, String storedHash) {
        if (rawCode == null) {
            return false;
        }
        return HashUtils.constantTimeEquals(storedHash, hash(rawCode.trim()));
    }
}
