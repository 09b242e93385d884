package com.sparta.farmshare.infrastructure.external.paystack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Paystack 공통 응답 봉투 { status, message, data }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaystackResponse<T>(
        boolean status,
        String message,
        T data
) {
}
