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
 * 이메일별 OTP 검증 실패 기록
 * 최대 실패 횟수에 도달하면 일정 시간 잠금
 */
@Entity
@Table(name = "otp_attempts", indexes = {
        @Index(name = "uk_otp_attempts_email", columnList = "email", unique = true)
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OtpAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_attempt_at")
    private LocalDateTime lastAttemptAt;

    @Column(name = "locked_until")
    private LocalDateTime lockedUntil;

    @Column(name = "ip_address")
    private String ipAddress;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static OtpAttempt start(String email, LocalDateTime now) {
        return OtpAttempt.builder()
                .email(email)
                .attempts(0)
                .updatedAt(now)
                .build();
    }

    /**
     * 실패 1회 기록
     * 이전 잠금이 이미 풀렸다면 카운트를 새로 시작한다
     *
     * @return 이번 실패로 잠겼는지 여부
     */
    public boolean recordFailure(LocalDateTime now, String ipAddress, int maxAttempts, Duration lockout) {
        if (lockedUntil != null && !lockedUntil.isAfter(now)) {
            this.attempts = 0;
            this.lockedUntil = null;
        }

        this.attempts++;
        this.lastAttemptAt = now;
        this.updatedAt = now;
        if (ipAddress != null) {
            this.ipAddress = ipAddress;
        }

        if (attempts >= maxAttempts) {
            this.lockedUntil = now.plus(lockout);
            return true;
        }
        return false;
    }

    public boolean isLocked(LocalDateTime now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    public boolean isRecentlyAttempted(LocalDateTime now, Duration window) {
        return lastAttemptAt != null && lastAttemptAt.isAfter(now.minus(window));
    }
}
