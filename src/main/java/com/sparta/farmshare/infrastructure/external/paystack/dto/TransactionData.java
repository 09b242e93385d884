package com.sparta.farmshare.infrastructure.external.paystack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 결제 조회 응답 (amount는 kobo 단위)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionData(
        Long id,
        String status,
        String reference,
        Long amount,
        @JsonProperty("gateway_response") String gatewayResponse,
        @JsonProperty("paid_at") String paidAt
) {
    public boolean isSuccessful() {
        return "success".equals(status);
    }
}
