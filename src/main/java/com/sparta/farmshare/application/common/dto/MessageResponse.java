package com.sparta.farmshare.application.common.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 메시지만 내려가는 응답
 */
public record MessageResponse(
        @Schema(description = "결과 메시지", example = "Password has been reset successfully")
        String message
) {
    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
