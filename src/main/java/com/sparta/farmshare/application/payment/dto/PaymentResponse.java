package com.sparta.farmshare.application.payment.dto;

import com.sparta.farmshare.domain.payment.entity.PaymentStatus;
import com.sparta.farmshare.domain.payment.entity.PaymentTransaction;

import java.time.LocalDateTime;

public record PaymentResponse(
        String reference,
        long amount,
        PaymentStatus status,
        String gatewayResponse,
        LocalDateTime paidAt
) {
    public static PaymentResponse from(PaymentTransaction payment) {
        return new PaymentResponse(
                payment.getReference(),
                payment.getAmount(),
                payment.getStatus(),
                payment.getGatewayResponse(),
                payment.getPaidAt()
        );
    }
}
