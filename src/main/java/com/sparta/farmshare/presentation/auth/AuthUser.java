package com.sparta.farmshare.presentation.auth;

import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.infrastructure.security.JwtClaims;

import java.time.Instant;

/**
 * 요청을 보낸 인증 사용자
 * tokenId / tokenExpiresAt은 로그아웃 시 블랙리스트 등록에 사용
 */
public record AuthUser(
        String userId,
        String email,
        Role role,
        String tokenId,
        Instant tokenExpiresAt
) {
    public static AuthUser from(JwtClaims claims) {
        return new AuthUser(
                claims.userId(),
                claims.email(),
                claims.role(),
                claims.jti(),
                claims.expiresAt()
        );
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
