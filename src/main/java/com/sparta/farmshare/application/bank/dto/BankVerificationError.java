package com.sparta.farmshare.application.bank.dto;

/**
 * 계좌 확인 실패 분류
 * serviceFault = true 이면 사용자 입력이 아닌 서비스 쪽 문제 (503)
 */
public enum BankVerificationError {
    NOT_CONFIGURED("Paystack API key not configured", true),
    BAD_REQUEST("Bad request", false),
    AUTHENTICATION_FAILED("Authentication failed", true),
    INVALID_ACCOUNT("Invalid account", false),
    RATE_LIMITED("Rate limit exceeded", true),
    SERVICE_UNAVAILABLE("Service unavailable", true),
    TIMEOUT("Request timeout", true),
    INVALID_RESPONSE("Invalid response from Paystack", true),
    PROVIDER_ERROR("Provider error", false),
    UNKNOWN("Unknown error", true);

    private final String label;
    private final boolean serviceFault;

    BankVerificationError(String label, boolean serviceFault) {
        this.label = label;
        this.serviceFault = serviceFault;
    }

    public String getLabel() {
        return label;
    }

    public boolean isServiceFault() {
        return serviceFault;
    }
}
