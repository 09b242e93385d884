package com.sparta.farmshare.application.payment.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

import java.util.Map;

public record InitializePaymentRequest(
        @Positive(message = "Amount must be greater than zero")
        @Max(value = 100_000_000L, message = "Amount exceeds the allowed maximum")
        long amount,

        Map<String, Object> metadata
) {
}
