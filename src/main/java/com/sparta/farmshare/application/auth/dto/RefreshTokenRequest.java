package com.sparta.farmshare.application.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record RefreshTokenRequest(
        @Schema(description = "Refresh Token")
        @NotBlank(message = "Refresh token is required")
        String refreshToken
) {
}
