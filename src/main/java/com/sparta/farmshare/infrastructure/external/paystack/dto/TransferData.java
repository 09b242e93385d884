package com.sparta.farmshare.infrastructure.external.paystack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 이체 생성 / 조회 응답
 * status: success, pending, otp, received, failed, reversed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransferData(
        String reference,
        @JsonProperty("transfer_code") String transferCode,
        String status,
        Long amount,
        String reason
) {
}
