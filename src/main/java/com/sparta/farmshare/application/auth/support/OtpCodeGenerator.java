package com.sparta.farmshare.application.auth.support;

import com.sparta.farmshare.common.config.properties.OtpProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 숫자 OTP 생성기 (기본 6자리, 앞자리 0 허용)
 */
@Component
@RequiredArgsConstructor
public class OtpCodeGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final OtpProperties otpProperties;

    public String generate() {
        int length = otpProperties.length();
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(RANDOM.nextInt(10));
        }
        return code.toString();
    }
}
