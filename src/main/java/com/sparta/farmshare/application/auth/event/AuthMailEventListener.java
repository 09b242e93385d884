package com.sparta.farmshare.application.auth.event;

import com.sparta.farmshare.infrastructure.mail.EmailSendException;
import com.sparta.farmshare.infrastructure.mail.EmailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 인증 관련 메일 발송
 *
 * 트랜잭션 커밋 이후에만 발송한다.
 * 발송 실패는 가입/재설정 요청 자체를 실패시키지 않는다 (재발송 API로 복구)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthMailEventListener {

    private final EmailService emailService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleSignupOtpIssued(SignupOtpIssuedEvent event) {
        try {
            emailService.sendOtpEmail(event.email(), event.name(), event.otp(), event.ttlMinutes());
        } catch (EmailSendException e) {
            log.error("[이벤트 리스너] OTP 메일 발송 실패 - email={}", event.email(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handlePasswordResetRequested(PasswordResetRequestedEvent event) {
        try {
            emailService.sendPasswordResetEmail(event.email(), event.name(), event.resetToken());
        } catch (EmailSendException e) {
            log.error("[이벤트 리스너] 비밀번호 재설정 메일 발송 실패 - email={}", event.email(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleAdminSignedUp(AdminSignedUpEvent event) {
        try {
            emailService.sendAdminWelcomeEmail(event.email(), event.name());
        } catch (EmailSendException e) {
            log.error("[이벤트 리스너] 관리자 환영 메일 발송 실패 - email={}", event.email(), e);
        }
    }
}
