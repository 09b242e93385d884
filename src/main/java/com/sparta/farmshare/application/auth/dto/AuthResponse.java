package com.sparta.farmshare.application.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 토큰 발급 응답 DTO
 */
public record AuthResponse(
        @Schema(description = "Access Token (15분)")
        String accessToken,

        @Schema(description = "Refresh Token (7일)")
        String refreshToken,

        @Schema(description = "토큰 타입", example = "Bearer")
        String tokenType,

        @Schema(description = "Access Token 만료까지 남은 초", example = "900")
        long expiresIn,

        @Schema(description = "로그인한 사용자")
        UserResponse user
) {
}
