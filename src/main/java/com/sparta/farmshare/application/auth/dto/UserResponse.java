package com.sparta.farmshare.application.auth.dto;

import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.entity.User;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

/**
 * 사용자 프로필 응답 DTO
 */
public record UserResponse(
        @Schema(description = "사용자 ID")
        String userId,

        @Schema(description = "이메일", example = "ada@farmshare.ng")
        String email,

        @Schema(description = "이름", example = "Ada Obi")
        String name,

        @Schema(description = "전화번호")
        String phone,

        @Schema(description = "역할", example = "VENDOR")
        Role role,

        @Schema(description = "이메일 인증 여부")
        boolean verified,

        @Schema(description = "프로필 이미지")
        String avatarUrl,

        @Schema(description = "정산 계좌 인증 여부")
        boolean bankVerified,

        @Schema(description = "정산 계좌 예금주")
        String accountName,

        @Schema(description = "가입 일시")
        LocalDateTime createdAt
) {
    public static UserResponse from(User user) {
        return new UserResponse(
                user.getUserId(),
                user.getEmail(),
                user.getName(),
                user.getPhone(),
                user.getRole(),
                user.isVerified(),
                user.getAvatarUrl(),
                user.isBankVerified(),
                user.getAccountName(),
                user.getCreatedAt()
        );
    }
}
