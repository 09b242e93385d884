package com.sparta.farmshare.domain.user.entity;

import com.sparta.farmshare.infrastructure.jpa.BaseEntity;
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
 * 사용자 도메인 엔티티
 *
 * 이메일 OTP 인증(또는 Google OAuth, 관리자 가입)을 마친 계정만 존재한다.
 * Refresh Token / 비밀번호 재설정 토큰은 SHA-256 해시만 저장
 */
@Entity
@Table(name = "users", indexes = {
        @Index(name = "uk_users_email", columnList = "email", unique = true),
        @Index(name = "uk_users_google_id", columnList = "google_id", unique = true)
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class User extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String userId;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private String name;

    private String phone;

    // OAuth 전용 계정은 비밀번호가 없다
    @Column(name = "password_hash")
    private String passwordHash;

    @Column(name = "google_id")
    private String googleId;

    @Column(name = "avatar_url")
    private String avatarUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Role role;

    private boolean verified;

    private boolean banned;

    @Column(name = "refresh_token_hash")
    private String refreshTokenHash;

    @Column(name = "reset_token_hash")
    private String resetTokenHash;

    @Column(name = "reset_token_expires_at")
    private LocalDateTime resetTokenExpiresAt;

    // 정산 계좌
    @Column(name = "account_number")
    private String accountNumber;

    @Column(name = "bank_code")
    private String bankCode;

    @Column(name = "account_name")
    private String accountName;

    @Column(name = "bank_verified")
    private boolean bankVerified;

    @Column(name = "paystack_recipient_code")
    private String paystackRecipientCode;

    @Column(name = "last_active_at")
    private LocalDateTime lastActiveAt;

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean hasPassword() {
        return passwordHash != null;
    }

    public void markActive(LocalDateTime now) {
        this.lastActiveAt = now;
    }

    public void updateRefreshTokenHash(String refreshTokenHash) {
        this.refreshTokenHash = refreshTokenHash;
    }

    public void clearRefreshToken() {
        this.refreshTokenHash = null;
    }

    /**
     * 비밀번호 재설정 토큰 발급
     * @param tokenHash 토큰의 SHA-256 해시
     * @param expiresAt 만료 시각
     */
    public void issueResetToken(String tokenHash, LocalDateTime expiresAt) {
        this.resetTokenHash = tokenHash;
        this.resetTokenExpiresAt = expiresAt;
    }

    public boolean isResetTokenValid(String tokenHash, LocalDateTime now) {
        return resetTokenHash != null
                && resetTokenHash.equals(tokenHash)
                && resetTokenExpiresAt != null
                && resetTokenExpiresAt.isAfter(now);
    }

    /**
     * 비밀번호 변경
     * 재설정 토큰과 Refresh Token을 함께 폐기하여 모든 세션을 끊는다
     */
    public void resetPassword(String newPasswordHash) {
        this.passwordHash = newPasswordHash;
        this.resetTokenHash = null;
        this.resetTokenExpiresAt = null;
        this.refreshTokenHash = null;
    }

    /**
     * 기존 이메일 계정에 Google 계정 연결
     */
    public void linkGoogleAccount(String googleId, String avatarUrl) {
        this.googleId = googleId;
        if (this.avatarUrl == null) {
            this.avatarUrl = avatarUrl;
        }
        // Google이 이메일 소유를 확인했으므로 인증된 것으로 본다
        this.verified = true;
    }

    /**
     * 인증된 정산 계좌 등록
     * 계좌가 바뀌면 기존 Paystack 수취인 코드는 무효
     */
    public void registerBankAccount(String accountNumber, String bankCode, String accountName) {
        this.accountNumber = accountNumber;
        this.bankCode = bankCode;
        this.accountName = accountName;
        this.bankVerified = true;
        this.paystackRecipientCode = null;
    }

    public void assignRecipientCode(String recipientCode) {
        this.paystackRecipientCode = recipientCode;
    }

    public boolean hasVerifiedBankAccount() {
        return bankVerified && accountNumber != null && bankCode != null;
    }

    public void ban() {
        this.banned = true;
        this.refreshTokenHash = null;
    }
}
