package com.sparta.farmshare.application.bank.dto;

public record BankServiceHealthResponse(
        boolean healthy,
        String service
) {
    public static BankServiceHealthResponse of(boolean healthy) {
        return new BankServiceHealthResponse(healthy, "paystack");
    }
}
