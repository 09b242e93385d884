package com.sparta.farmshare.application.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @Schema(description = "이메일", example = "ada@farmshare.ng")
        @NotBlank(message = "Email is required")
        String email,

        @Schema(description = "비밀번호", example = "str0ngPassword")
        @NotBlank(message = "Password is required")
        String password
) {
}
