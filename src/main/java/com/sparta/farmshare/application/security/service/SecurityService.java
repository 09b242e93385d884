package com.sparta.farmshare.application.security.service;

import com.sparta.farmshare.common.config.properties.SecurityPolicyProperties;
import com.sparta.farmshare.domain.security.entity.OtpAttempt;
import com.sparta.farmshare.domain.security.entity.PaymentRateLimit;
import com.sparta.farmshare.domain.security.entity.WebhookEvent;
import com.sparta.farmshare.domain.security.exception.RateLimitExceededException;
import com.sparta.farmshare.domain.security.repository.OtpAttemptRepository;
import com.sparta.farmshare.domain.security.repository.PaymentRateLimitRepository;
import com.sparta.farmshare.domain.security.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 보안 정책 서비스
 *
 * 1. OTP 검증: 실패 누적 시 잠금 (기본 5회 / 15분), 분당 시도 제한
 * 2. 결제: 시간당 결제 시작 제한 (기본 5회), 연속 실패 시 차단 (기본 3회 / 30분)
 * 3. 웹훅: (provider, eventId) 기준 중복 처리 방지
 *
 * 호출자 트랜잭션에 참여한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class SecurityService {

    private static final Duration OTP_RATE_WINDOW = Duration.ofMinutes(1);
    private static final Duration OTP_ATTEMPT_RETENTION = Duration.ofHours(24);

    private final OtpAttemptRepository otpAttemptRepository;
    private final PaymentRateLimitRepository paymentRateLimitRepository;
    private final WebhookEventRepository webhookEventRepository;
    private final SecurityPolicyProperties policy;
    private final Clock clock;

    // ===== OTP =====

    /**
     * OTP 검증 가능 여부 확인
     * @throws RateLimitExceededException 잠금 중이거나 1분 내 시도가 너무 많을 때
     */
    @Transactional(readOnly = true)
    public void checkOtpRateLimit(String email) {
        LocalDateTime now = LocalDateTime.now(clock);

        otpAttemptRepository.findByEmail(email).ifPresent(attempt -> {
            if (attempt.isLocked(now)) {
                long minutes = remainingMinutes(now, attempt.getLockedUntil());
                log.warn("OTP 잠금 상태에서 검증 시도 - email={}, remainingMinutes={}", email, minutes);
                throw new RateLimitExceededException(
                        "Too many failed attempts. Please try again in " + minutes + " minutes.");
            }

            if (attempt.isRecentlyAttempted(now, OTP_RATE_WINDOW)
                    && attempt.getAttempts() >= policy.otpAttemptsPerMinute()) {
                log.warn("OTP 분당 시도 제한 초과 - email={}", email);
                throw new RateLimitExceededException(
                        "Too many requests. Please wait a minute before trying again.");
            }
        });
    }

    public void recordFailedOtpAttempt(String email, String ipAddress) {
        LocalDateTime now = LocalDateTime.now(clock);

        OtpAttempt attempt = otpAttemptRepository.findByEmail(email)
                .orElseGet(() -> OtpAttempt.start(email, now));

        boolean locked = attempt.recordFailure(now, ipAddress, policy.otpMaxAttempts(), policy.otpLockout());
        otpAttemptRepository.save(attempt);

        if (locked) {
            log.warn("OTP 실패 횟수 초과로 잠금 - email={}, attempts={}, lockedUntil={}",
                    email, attempt.getAttempts(), attempt.getLockedUntil());
        } else {
            log.info("OTP 검증 실패 기록 - email={}, attempts={}", email, attempt.getAttempts());
        }
    }

    public void clearOtpAttempts(String email) {
        otpAttemptRepository.deleteByEmail(email);
    }

    // ===== 결제 =====

    /**
     * 결제 시작 가능 여부 확인
     * @throws RateLimitExceededException 차단 중이거나 시간당 한도에 도달했을 때
     */
    @Transactional(readOnly = true)
    public void checkPaymentRateLimit(String userId) {
        LocalDateTime now = LocalDateTime.now(clock);

        paymentRateLimitRepository.findByUserId(userId).ifPresent(limit -> {
            if (limit.isBlocked(now)) {
                long minutes = remainingMinutes(now, limit.getBlockedUntil());
                log.warn("결제 차단 상태에서 결제 시도 - userId={}, remainingMinutes={}", userId, minutes);
                throw new RateLimitExceededException(
                        "Payment temporarily blocked due to failed attempts. Please try again in " + minutes + " minutes.");
            }

            if (limit.isWindowActive(now) && limit.getInitiations() >= policy.paymentMaxInitiationsPerHour()) {
                log.warn("시간당 결제 시도 한도 도달 - userId={}, initiations={}", userId, limit.getInitiations());
                throw new RateLimitExceededException(
                        "Maximum payment attempts reached. Please try again in an hour.");
            }
        });
    }

    public void recordPaymentInitiation(String userId) {
        LocalDateTime now = LocalDateTime.now(clock);

        PaymentRateLimit limit = paymentRateLimitRepository.findByUserId(userId)
                .orElseGet(() -> PaymentRateLimit.start(userId, now));
        limit.recordInitiation(now);
        paymentRateLimitRepository.save(limit);
    }

    public void recordPaymentFailure(String userId) {
        LocalDateTime now = LocalDateTime.now(clock);

        PaymentRateLimit limit = paymentRateLimitRepository.findByUserId(userId)
                .orElseGet(() -> PaymentRateLimit.start(userId, now));
        boolean blocked = limit.recordFailure(now, policy.paymentMaxFailures(), policy.paymentBlock());
        paymentRateLimitRepository.save(limit);

        if (blocked) {
            log.warn("결제 연속 실패로 차단 - userId={}, blockedUntil={}", userId, limit.getBlockedUntil());
        }
    }

    public void clearPaymentFailures(String userId) {
        paymentRateLimitRepository.findByUserId(userId)
                .ifPresent(PaymentRateLimit::clearFailures);
    }

    // ===== 웹훅 =====

    @Transactional(readOnly = true)
    public boolean isWebhookProcessed(String provider, String eventId) {
        return webhookEventRepository.existsByProviderAndEventId(provider, eventId);
    }

    public void markWebhookProcessed(String provider, String eventId, String eventType, String signature) {
        webhookEventRepository.save(WebhookEvent.builder()
                .provider(provider)
                .eventId(eventId)
                .eventType(eventType)
                .signature(signature)
                .processedAt(LocalDateTime.now(clock))
                .build());
    }

    // ===== 정리 작업 =====

    public int cleanupOldOtpAttempts() {
        LocalDateTime now = LocalDateTime.now(clock);
        return otpAttemptRepository.deleteStale(now.minus(OTP_ATTEMPT_RETENTION), now);
    }

    public int cleanupOldWebhookEvents() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(policy.webhookRetention());
        return webhookEventRepository.deleteProcessedBefore(cutoff);
    }

    public int resetExpiredPaymentWindows() {
        LocalDateTime now = LocalDateTime.now(clock);
        return paymentRateLimitRepository.resetExpiredWindows(now.minus(PaymentRateLimit.WINDOW), now);
    }

    private long remainingMinutes(LocalDateTime now, LocalDateTime until) {
        long seconds = Duration.between(now, until).getSeconds();
        return Math.max(1, (seconds + 59) / 60);
    }
}
