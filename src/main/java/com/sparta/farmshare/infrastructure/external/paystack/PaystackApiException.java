package com.sparta.farmshare.infrastructure.external.paystack;

/**
 * Paystack이 200을 돌려줬지만 status=false 이거나 data가 비어 있는 경우
 */
public class PaystackApiException extends RuntimeException {

    public PaystackApiException(String message) {
        super(message);
    }
}
