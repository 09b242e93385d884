package com.sparta.farmshare.application.bank.dto;

/**
 * Paystack 계좌 확인 결과
 *
 * @param error 실패 분류 라벨 (성공 시 null). PROVIDER_ERROR는 Paystack 메시지를 그대로 담는다
 */
public record BankVerificationResult(
        boolean success,
        String accountName,
        String accountNumber,
        String bankCode,
        String message,
        String error,
        BankVerificationError errorType
) {

    public static BankVerificationResult verified(String accountName, String accountNumber, String bankCode) {
        return new BankVerificationResult(true, accountName, accountNumber, bankCode,
                "Bank account verified successfully", null, null);
    }

    public static BankVerificationResult failed(BankVerificationError errorType, String message) {
        return new BankVerificationResult(false, null, null, null, message, errorType.getLabel(), errorType);
    }

    public static BankVerificationResult failed(BankVerificationError errorType, String error, String message) {
        return new BankVerificationResult(false, null, null, null, message, error, errorType);
    }
}
