package com.sparta.farmshare.application.bank.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyBankRequest(
        @NotBlank(message = "Account number is required")
        String accountNumber,

        @NotBlank(message = "Bank code is required")
        String bankCode
) {
}
