package com.sparta.farmshare.application.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * OTP 인증 요청 DTO
 */
public record VerifyOtpRequest(
        @Schema(description = "이메일", example = "ada@farmshare.ng")
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email,

        @Schema(description = "메일로 받은 OTP", example = "482913")
        @NotBlank(message = "OTP is required")
        String otp
) {
}
