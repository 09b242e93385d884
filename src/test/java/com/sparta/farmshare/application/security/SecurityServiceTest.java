package com.sparta.farmshare.application.security;

import com.sparta.farmshare.application.security.service.SecurityService;
import com.sparta.farmshare.common.config.properties.SecurityPolicyProperties;
import com.sparta.farmshare.domain.security.entity.OtpAttempt;
import com.sparta.farmshare.domain.security.entity.PaymentRateLimit;
import com.sparta.farmshare.domain.security.exception.RateLimitExceededException;
import com.sparta.farmshare.domain.security.repository.OtpAttemptRepository;
import com.sparta.farmshare.domain.security.repository.PaymentRateLimitRepository;
import com.sparta.farmshare.domain.security.repository.WebhookEventRepository;
import com.sparta.farmshare.domain.security.entity.WebhookEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

/**
 * 보안 정책 서비스 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SecurityService 테스트")
class SecurityServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private OtpAttemptRepository otpAttemptRepository;

    @Mock
    private PaymentRateLimitRepository paymentRateLimitRepository;

    @Mock
    private WebhookEventRepository webhookEventRepository;

    private SecurityService securityService;
    private LocalDateTime now;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        now = LocalDateTime.now(clock);
        SecurityPolicyProperties policy = new SecurityPolicyProperties(
                5, Duration.ofMinutes(15), 3, 5, 3, Duration.ofMinutes(30), Duration.ofDays(30));
        securityService = new SecurityService(otpAttemptRepository, paymentRateLimitRepository,
                webhookEventRepository, policy, clock);
    }

    @Test
    @DisplayName("OTP 실패 5회째에 15분 잠금된다")
    void OTP_실패_누적_잠금() {
        // given
        OtpAttempt attempt = OtpAttempt.start("ada@farmshare.ng", now.minusHours(1));
        for (int i = 0; i < 4; i++) {
            attempt.recordFailure(now.minusMinutes(10), "127.0.0.1", 5, Duration.ofMinutes(15));
        }
        given(otpAttemptRepository.findByEmail("ada@farmshare.ng")).willReturn(Optional.of(attempt));

        // when
        securityService.recordFailedOtpAttempt("ada@farmshare.ng", "10.0.0.1");

        // then
        assertThat(attempt.getAttempts()).isEqualTo(5);
        assertThat(attempt.getLockedUntil()).isEqualTo(now.plusMinutes(15));
        assertThat(attempt.getIpAddress()).isEqualTo("10.0.0.1");
        verify(otpAttemptRepository).save(attempt);
    }

    @Test
    @DisplayName("잠금 중이면 남은 분을 포함한 메시지로 거부한다")
    void OTP_잠금_중_거부() {
        // given
        OtpAttempt attempt = OtpAttempt.start("ada@farmshare.ng", now);
        for (int i = 0; i < 5; i++) {
            attempt.recordFailure(now.minusMinutes(5), null, 5, Duration.ofMinutes(15));
        }
        given(otpAttemptRepository.findByEmail("ada@farmshare.ng")).willReturn(Optional.of(attempt));

        // when & then
        assertThatThrownBy(() -> securityService.checkOtpRateLimit("ada@farmshare.ng"))
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessageContaining("10 minutes");
    }

    @Test
    @DisplayName("1분 내 시도가 한도에 도달하면 거부한다")
    void OTP_분당_제한() {
        // given
        OtpAttempt attempt = OtpAttempt.start("ada@farmshare.ng", now);
        for (int i = 0; i < 3; i++) {
            attempt.recordFailure(now.minusSeconds(20), null, 5, Duration.ofMinutes(15));
        }
        given(otpAttemptRepository.findByEmail("ada@farmshare.ng")).willReturn(Optional.of(attempt));

        // when & then
        assertThatThrownBy(() -> securityService.checkOtpRateLimit("ada@farmshare.ng"))
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessageContaining("wait a minute");
    }

    @Test
    @DisplayName("잠금이 풀린 뒤의 실패는 횟수를 새로 센다")
    void 잠금_만료_후_초기화() {
        // given
        OtpAttempt attempt = OtpAttempt.start("ada@farmshare.ng", now.minusHours(1));
        for (int i = 0; i < 5; i++) {
            attempt.recordFailure(now.minusMinutes(30), null, 5, Duration.ofMinutes(15));
        }
        given(otpAttemptRepository.findByEmail("ada@farmshare.ng")).willReturn(Optional.of(attempt));

        // when
        securityService.recordFailedOtpAttempt("ada@farmshare.ng", null);

        // then
        assertThat(attempt.getAttempts()).isEqualTo(1);
        assertThat(attempt.isLocked(now)).isFalse();
    }

    @Test
    @DisplayName("기록이 없으면 결제 시작을 허용한다")
    void 결제_제한_기록_없음() {
        // given
        given(paymentRateLimitRepository.findByUserId("U1")).willReturn(Optional.empty());

        // when & then
        assertThatCode(() -> securityService.checkPaymentRateLimit("U1")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("1시간 안에 5회 결제를 시작했으면 거부한다")
    void 결제_시간당_한도() {
        // given
        PaymentRateLimit limit = PaymentRateLimit.start("U1", now.minusMinutes(30));
        for (int i = 0; i < 5; i++) {
            limit.recordInitiation(now.minusMinutes(20));
        }
        given(paymentRateLimitRepository.findByUserId("U1")).willReturn(Optional.of(limit));

        // when & then
        assertThatThrownBy(() -> securityService.checkPaymentRateLimit("U1"))
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessageContaining("Maximum payment attempts reached");
    }

    @Test
    @DisplayName("결제 연속 3회 실패 시 30분 차단된다")
    void 결제_연속_실패_차단() {
        // given
        PaymentRateLimit limit = PaymentRateLimit.start("U1", now);
        limit.recordFailure(now, 3, Duration.ofMinutes(30));
        limit.recordFailure(now, 3, Duration.ofMinutes(30));
        given(paymentRateLimitRepository.findByUserId("U1")).willReturn(Optional.of(limit));

        // when
        securityService.recordPaymentFailure("U1");

        // then
        assertThat(limit.isBlocked(now)).isTrue();
        assertThat(limit.getBlockedUntil()).isEqualTo(now.plusMinutes(30));
        assertThatThrownBy(() -> securityService.checkPaymentRateLimit("U1"))
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessageContaining("30 minutes");
    }

    @Test
    @DisplayName("결제 성공 시 실패 기록과 차단이 해제된다")
    void 결제_실패_초기화() {
        // given
        PaymentRateLimit limit = PaymentRateLimit.start("U1", now);
        for (int i = 0; i < 3; i++) {
            limit.recordFailure(now, 3, Duration.ofMinutes(30));
        }
        given(paymentRateLimitRepository.findByUserId("U1")).willReturn(Optional.of(limit));

        // when
        securityService.clearPaymentFailures("U1");

        // then
        assertThat(limit.isBlocked(now)).isFalse();
        assertThat(limit.getFailedAttempts()).isZero();
    }

    @Test
    @DisplayName("처리한 웹훅은 provider와 eventId, 서명과 함께 기록된다")
    void 웹훅_처리_기록() {
        // when
        securityService.markWebhookProcessed("paystack", "charge.success:123", "charge.success", "a1b2c3");

        // then
        ArgumentCaptor<WebhookEvent> captor = ArgumentCaptor.forClass(WebhookEvent.class);
        verify(webhookEventRepository).save(captor.capture());
        assertThat(captor.getValue().getProvider()).isEqualTo("paystack");
        assertThat(captor.getValue().getEventId()).isEqualTo("charge.success:123");
        assertThat(captor.getValue().getSignature()).isEqualTo("a1b2c3");
        assertThat(captor.getValue().getProcessedAt()).isEqualTo(now);
    }
}
