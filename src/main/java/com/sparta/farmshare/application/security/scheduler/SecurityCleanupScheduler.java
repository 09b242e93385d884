package com.sparta.farmshare.application.security.scheduler;

import com.sparta.farmshare.application.security.service.SecurityService;
import com.sparta.farmshare.domain.auth.repository.PendingSignupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 보안 테이블 주기 정리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecurityCleanupScheduler {

    private final SecurityService securityService;
    private final PendingSignupRepository pendingSignupRepository;
    private final Clock clock;

    /**
     * 매시 정각: 오래된 OTP 실패 기록, 30일 지난 웹훅 기록 삭제
     */
    @Scheduled(cron = "0 0 * * * *")
    public void cleanupSecurityRecords() {
        int otpAttempts = securityService.cleanupOldOtpAttempts();
        int webhookEvents = securityService.cleanupOldWebhookEvents();
        log.info("보안 기록 정리 완료 - otpAttempts={}건, webhookEvents={}건", otpAttempts, webhookEvents);
    }

    /**
     * 6시간마다: 지난 결제 윈도우 초기화
     */
    @Scheduled(cron = "0 0 */6 * * *")
    public void resetPaymentWindows() {
        int reset = securityService.resetExpiredPaymentWindows();
        log.info("결제 시도 윈도우 초기화 완료 - {}건", reset);
    }

    /**
     * 매일 03:30: OTP 만료 후 24시간 지난 가입 대기 요청 삭제
     */
    @Scheduled(cron = "0 30 3 * * *")
    @Transactional
    public void purgeExpiredPendingSignups() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(24);
        int deleted = pendingSignupRepository.deleteExpiredBefore(cutoff);
        log.info("만료된 가입 대기 요청 정리 완료 - {}건", deleted);
    }
}
