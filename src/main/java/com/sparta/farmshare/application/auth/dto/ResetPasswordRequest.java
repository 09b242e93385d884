package com.sparta.farmshare.application.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 비밀번호 재설정 요청 DTO
 */
public record ResetPasswordRequest(
        @Schema(description = "이메일", example = "ada@farmshare.ng")
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email,

        @Schema(description = "메일 링크에 포함된 재설정 토큰")
        @NotBlank(message = "Reset token is required")
        String token,

        @Schema(description = "새 비밀번호 (8자 이상)", example = "n3wPassword!")
        @NotBlank(message = "New password is required")
        @Size(min = 8, message = "Password must be at least 8 characters long")
        String newPassword
) {
}
