package com.sparta.farmshare.domain.security.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 사용자별 결제 시도 제한
 * - 1시간 윈도우 내 결제 시작 횟수
 * - 연속 실패 횟수와 차단 시각
 */
@Entity
@Table(name = "payment_rate_limits", indexes = {
        @Index(name = "uk_payment_rate_limits_user", columnList = "user_id", unique = true)
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentRateLimit {

    public static final Duration WINDOW = Duration.ofHours(1);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private int initiations;

    @Column(name = "window_started_at", nullable = false)
    private LocalDateTime windowStartedAt;

    @Column(name = "failed_attempts", nullable = false)
    private int failedAttempts;

    @Column(name = "blocked_until")
    private LocalDateTime blockedUntil;

    public static PaymentRateLimit start(String userId, LocalDateTime now) {
        return PaymentRateLimit.builder()
                .userId(userId)
                .initiations(0)
                .windowStartedAt(now)
                .failedAttempts(0)
                .build();
    }

    /**
     * 결제 시작 1회 기록
     * 윈도우가 1시간을 넘겼을 때만 새로 시작
     */
    public void recordInitiation(LocalDateTime now) {
        if (!isWindowActive(now)) {
            this.windowStartedAt = now;
            this.initiations = 0;
        }
        this.initiations++;
    }

    /**
     * @return 이번 실패로 차단되었는지 여부
     */
    public boolean recordFailure(LocalDateTime now, int maxFailures, Duration block) {
        this.failedAttempts++;
        if (failedAttempts >= maxFailures) {
            this.blockedUntil = now.plus(block);
            this.failedAttempts = 0;
            return true;
        }
        return false;
    }

    public void clearFailures() {
        this.failedAttempts = 0;
        this.blockedUntil = null;
    }

    public boolean isBlocked(LocalDateTime now) {
        return blockedUntil != null && blockedUntil.isAfter(now);
    }

    public boolean isWindowActive(LocalDateTime now) {
        return windowStartedAt.isAfter(now.minus(WINDOW));
    }
}
