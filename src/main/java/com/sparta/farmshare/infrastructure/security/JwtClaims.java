package com.sparta.farmshare.infrastructure.security;

import com.sparta.farmshare.domain.user.entity.Role;

import java.time.Instant;

/**
 * 검증이 끝난 JWT에서 꺼낸 값
 */
public record JwtClaims(
        String userId,
        String email,
        Role role,
        TokenType type,
        String jti,
        Instant expiresAt
) {
}
