package com.sparta.farmshare.application.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record SignupResponse(
        @Schema(description = "결과 메시지", example = "Signup successful. Please check your email for the OTP.")
        String message,

        @Schema(description = "OTP가 발송된 이메일", example = "ada@farmshare.ng")
        String email
) {
}
