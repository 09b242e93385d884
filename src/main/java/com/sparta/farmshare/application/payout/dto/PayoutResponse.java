package com.sparta.farmshare.application.payout.dto;

import com.sparta.farmshare.domain.payout.entity.Payout;
import com.sparta.farmshare.domain.payout.entity.PayoutStatus;

import java.time.LocalDateTime;

public record PayoutResponse(
        Long id,
        String vendorId,
        String reference,
        long grossAmount,
        long platformFee,
        long netAmount,
        PayoutStatus status,
        String transferCode,
        String reason,
        String failureReason,
        String initiatedBy,
        LocalDateTime createdAt,
        LocalDateTime completedAt
) {
    public static PayoutResponse from(Payout payout) {
        return new PayoutResponse(
                payout.getId(),
                payout.getVendorId(),
                payout.getReference(),
                payout.getGrossAmount(),
                payout.getPlatformFee(),
                payout.getNetAmount(),
                payout.getStatus(),
                payout.getTransferCode(),
                payout.getReason(),
                payout.getFailureReason(),
                payout.getInitiatedBy(),
                payout.getCreatedAt(),
                payout.getCompletedAt()
        );
    }
}
