package com.sparta.farmshare.application.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * 이메일만 받는 요청 (OTP 재발송, 비밀번호 찾기)
 */
public record EmailRequest(
        @Schema(description = "이메일", example = "ada@farmshare.ng")
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email
) {
}
