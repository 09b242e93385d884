package com.sparta.farmshare.domain.payment.entity;

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
 * Paystack 결제 (체크아웃) 기록
 * amount는 나이라 정수, Paystack에는 kobo로 전달된다
 */
@Entity
@Table(name = "payment_transactions", indexes = {
        @Index(name = "uk_payment_transactions_reference", columnList = "reference", unique = true),
        @Index(name = "idx_payment_transactions_user", columnList = "user_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentTransaction extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false, length = 64)
    private String reference;

    @Column(nullable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "authorization_url", length = 512)
    private String authorizationUrl;

    @Column(name = "access_code")
    private String accessCode;

    @Column(name = "gateway_response")
    private String gatewayResponse;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    public static PaymentTransaction pending(String userId, String email, String reference, long amount,
                                             String authorizationUrl, String accessCode) {
        return PaymentTransaction.builder()
                .userId(userId)
                .email(email)
                .reference(reference)
                .amount(amount)
                .status(PaymentStatus.PENDING)
                .authorizationUrl(authorizationUrl)
                .accessCode(accessCode)
                .build();
    }

    public boolean isOwnedBy(String userId) {
        return this.userId.equals(userId);
    }

    public boolean isSuccessful() {
        return status == PaymentStatus.SUCCESS;
    }

    /**
     * Paystack 금액(kobo)이 요청 금액과 일치하는지
     */
    public boolean matchesAmountInKobo(Long amountInKobo) {
        return amountInKobo != null && amountInKobo == amount * 100L;
    }

    public void markSuccess(String gatewayResponse, LocalDateTime paidAt) {
        this.status = PaymentStatus.SUCCESS;
        this.gatewayResponse = gatewayResponse;
        this.paidAt = paidAt;
    }

    public void markFailed(String gatewayResponse) {
        this.status = PaymentStatus.FAILED;
        this.gatewayResponse = gatewayResponse;
    }
}
