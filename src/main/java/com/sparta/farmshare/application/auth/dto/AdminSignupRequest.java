package com.sparta.farmshare.application.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 관리자 가입 요청 DTO
 */
public record AdminSignupRequest(
        @Schema(description = "이메일", example = "ops@farmshare.ng")
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email,

        @Schema(description = "이름", example = "Ops Admin")
        @NotBlank(message = "Name is required")
        String name,

        @Schema(description = "비밀번호 (8자 이상)")
        @NotBlank(message = "Password is required")
        @Size(min = 8, message = "Password must be at least 8 characters long")
        String password,

        @Schema(description = "관리자 가입 비밀키")
        @NotBlank(message = "Admin secret key is required")
        String adminSecretKey
) {
}
