package com.sparta.farmshare.application.auth.event;

/**
 * OTP 발급 이벤트
 * 커밋 이후 메일 발송용으로만 쓰이며 OTP 원문은 여기서만 전달된다
 */
public record SignupOtpIssuedEvent(
        String email,
        String name,
        String otp,
        long ttlMinutes
) {
}
