package com.sparta.farmshare.application.auth.service;

import com.sparta.farmshare.application.auth.dto.AuthResponse;
import com.sparta.farmshare.application.auth.dto.UserResponse;
import com.sparta.farmshare.common.util.HashUtils;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.infrastructure.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Access / Refresh Token 쌍 발급
 *
 * 호출자의 트랜잭션 안에서 실행된다.
 * Refresh Token은 SHA-256 해시만 User에 저장 (이전 토큰은 즉시 무효)
 */
@Service
@RequiredArgsConstructor
public class TokenService {

    private static final String TOKEN_TYPE = "Bearer";

    private final JwtTokenProvider jwtTokenProvider;

    public AuthResponse issueTokens(User user) {
        String accessToken = jwtTokenProvider.createAccessToken(user);
        String refreshToken = jwtTokenProvider.createRefreshToken(user);

        user.updateRefreshTokenHash(HashUtils.sha256Hex(refreshToken));

        return new AuthResponse(
                accessToken,
                refreshToken,
                TOKEN_TYPE,
                jwtTokenProvider.getAccessTokenTtlSeconds(),
                UserResponse.from(user)
        );
    }
}
