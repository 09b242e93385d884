package com.sparta.farmshare.application.payment.dto;

public record InitializePaymentResponse(
        String authorizationUrl,
        String accessCode,
        String reference
) {
}
