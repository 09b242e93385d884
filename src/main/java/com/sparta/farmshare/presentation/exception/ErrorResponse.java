package com.sparta.farmshare.presentation.exception;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 에러 응답 DTO
 */
public record ErrorResponse(
        @Schema(description = "에러 코드", example = "A001")
        String code,

        @Schema(description = "에러 메시지", example = "Invalid email or password")
        String message
) {
}
