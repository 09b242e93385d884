package com.sparta.farmshare.domain.payout.entity;

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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * 판매자 정산 이체
 * 금액은 모두 나이라(NGN) 정수 단위
 */
@Entity
@Table(name = "payouts", indexes = {
        @Index(name = "uk_payouts_reference", columnList = "reference", unique = true),
        @Index(name = "idx_payouts_vendor", columnList = "vendor_id"),
        @Index(name = "idx_payouts_status", columnList = "status")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Payout extends BaseEntity {

    private static final BigDecimal PLATFORM_FEE_RATE = new BigDecimal("0.02");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vendor_id", nullable = false)
    private String vendorId;

    @Column(nullable = false, length = 64)
    private String reference;

    @Column(name = "gross_amount", nullable = false)
    private long grossAmount;

    @Column(name = "platform_fee", nullable = false)
    private long platformFee;

    @Column(name = "net_amount", nullable = false)
    private long netAmount;

    @Column(name = "recipient_code")
    private String recipientCode;

    @Column(name = "transfer_code")
    private String transferCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PayoutStatus status;

    private String reason;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "initiated_by", nullable = false)
    private String initiatedBy;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public static Payout create(String vendorId, String reference, long grossAmount,
                                String reason, String initiatedBy) {
        long fee = calculatePlatformFee(grossAmount);
        return Payout.builder()
                .vendorId(vendorId)
                .reference(reference)
                .grossAmount(grossAmount)
                .platformFee(fee)
                .netAmount(grossAmount - fee)
                .status(PayoutStatus.PENDING)
                .reason(reason)
                .initiatedBy(initiatedBy)
                .build();
    }

    /**
     * 플랫폼 수수료 2% (원 단위 반올림)
     */
    public static long calculatePlatformFee(long grossAmount) {
        return BigDecimal.valueOf(grossAmount)
                .multiply(PLATFORM_FEE_RATE)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    public void assignRecipient(String recipientCode) {
        this.recipientCode = recipientCode;
    }

    /**
     * Paystack 상태 반영
     * 늦게 도착한 조회/웹훅 결과가 최종 상태를 되돌리지 않는다
     *
     * @return 상태가 바뀌었으면 true
     */
    public boolean applyProviderStatus(String providerStatus, String transferCode, LocalDateTime now) {
        if (transferCode != null) {
            this.transferCode = transferCode;
        }
        return changeStatus(PayoutStatus.fromProvider(providerStatus), null, now);
    }

    public boolean markFailed(String failureReason, LocalDateTime now) {
        return changeStatus(PayoutStatus.FAILED, failureReason, now);
    }

    public boolean markCompleted(LocalDateTime now) {
        return changeStatus(PayoutStatus.COMPLETED, null, now);
    }

    public boolean markReversed(String failureReason, LocalDateTime now) {
        return changeStatus(PayoutStatus.REVERSED, failureReason, now);
    }

    private boolean changeStatus(PayoutStatus next, String failureReason, LocalDateTime now) {
        if (!this.status.canTransitionTo(next)) {
            return false;
        }
        this.status = next;
        if (failureReason != null) {
            this.failureReason = failureReason;
        }
        if (next == PayoutStatus.COMPLETED) {
            this.completedAt = now;
        }
        return true;
    }
}
