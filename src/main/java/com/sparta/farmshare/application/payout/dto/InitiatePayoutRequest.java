package com.sparta.farmshare.application.payout.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record InitiatePayoutRequest(
        @NotBlank(message = "Vendor id is required")
        String vendorId,

        @Positive(message = "Amount must be greater than zero")
        long amount,

        @Size(max = 200, message = "Reason must be at most 200 characters")
        String reason
) {
}
