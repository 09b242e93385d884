package com.sparta.farmshare.application.auth.dto;

import com.sparta.farmshare.domain.user.entity.Role;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 회원가입 요청 DTO
 */
public record SignupRequest(
        @Schema(description = "이메일", example = "ada@farmshare.ng")
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email,

        @Schema(description = "이름", example = "Ada Obi")
        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name,

        @Schema(description = "비밀번호 (8자 이상)", example = "str0ngPassword")
        @NotBlank(message = "Password is required")
        @Size(min = 8, message = "Password must be at least 8 characters long")
        String password,

        @Schema(description = "비밀번호 확인 (선택)", example = "str0ngPassword")
        String confirmPassword,

        @Schema(description = "전화번호 (선택)", example = "+2348012345678")
        String phone,

        @Schema(description = "역할 (BUYER/VENDOR, 기본 BUYER)", example = "VENDOR")
        Role role
) {
}
