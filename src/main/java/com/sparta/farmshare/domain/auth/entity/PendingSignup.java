package com.sparta.farmshare.domain.auth.entity;

import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.entity.User;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

import java.time.LocalDateTime;

/**
 * 이메일 인증 대기 중인 가입 요청
 *
 * 가입 → (OTP 검증) → User 생성 후 삭제.
 * 같은 이메일로 재가입하면 기존 행을 덮어쓴다.
 */
@Entity
@Table(name = "pending_signups", indexes = {
        @Index(name = "uk_pending_signups_email", columnList = "email", unique = true)
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PendingSignup {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private String name;

    private String phone;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Role role;

    @Column(name = "otp_hash", nullable = false)
    private String otpHash;

    @Column(name = "otp_expires_at", nullable = false)
    private LocalDateTime otpExpiresAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    /**
     * 재가입 시 입력값과 OTP 갱신
     */
    public void overwrite(String name, String phone, String passwordHash, Role role,
                          String otpHash, LocalDateTime otpExpiresAt) {
        this.name = name;
        this.phone = phone;
        this.passwordHash = passwordHash;
        this.role = role;
        renewOtp(otpHash, otpExpiresAt);
    }

    public void renewOtp(String otpHash, LocalDateTime otpExpiresAt) {
        this.otpHash = otpHash;
        this.otpExpiresAt = otpExpiresAt;
    }

    public boolean isOtpExpired(LocalDateTime now) {
        return !otpExpiresAt.isAfter(now);
    }

    /**
     * 인증 완료된 사용자로 전환
     */
    public User toVerifiedUser(LocalDateTime now) {
        return User.builder()
                .email(email)
                .name(name)
                .phone(phone)
                .passwordHash(passwordHash)
                .role(role)
                .verified(true)
                .lastActiveAt(now)
                .build();
    }
}
