package com.sparta.farmshare.application.bank.dto;

public record BankVerificationResponse(
        boolean success,
        String accountName,
        String accountNumber,
        String bankCode,
        String message
) {
    public static BankVerificationResponse from(BankVerificationResult result) {
        return new BankVerificationResponse(true, result.accountName(), result.accountNumber(),
                result.bankCode(), result.message());
    }
}
