package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.auth.event.SignupOtpIssuedEvent;
import com.sparta.farmshare.application.auth.support.OtpCodeGenerator;
import com.sparta.farmshare.application.auth.support.OtpHasher;
import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.application.security.service.SecurityService;
import com.sparta.farmshare.common.config.properties.OtpProperties;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.domain.auth.entity.PendingSignup;
import com.sparta.farmshare.domain.auth.exception.PendingSignupNotFoundException;
import com.sparta.farmshare.domain.auth.repository.PendingSignupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * OTP 재발송 유스케이스
 * 잠금 중인 이메일은 재발송도 막는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResendOtpUseCase {

    private final PendingSignupRepository pendingSignupRepository;
    private final SecurityService securityService;
    private final OtpCodeGenerator otpCodeGenerator;
    private final OtpHasher otpHasher;
    private final OtpProperties otpProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public MessageResponse execute(String rawEmail) {
        String email = EmailNormalizer.normalize(rawEmail);
        securityService.checkOtpRateLimit(email);

        PendingSignup pendingSignup = pendingSignupRepository.findByEmail(email)
                .orElseThrow(PendingSignupNotFoundException::new);

        String otp = otpCodeGenerator.generate();
        pendingSignup.renewOtp(otpHasher.hash(otp), LocalDateTime.now(clock).plus(otpProperties.ttl()));

        eventPublisher.publishEvent(new SignupOtpIssuedEvent(
                email, pendingSignup.getName(), otp, otpProperties.ttl().toMinutes()));

        log.info("OTP 재발송 - email={}", email);
        return MessageResponse.of("A new OTP has been sent to your email.");
    }
}
