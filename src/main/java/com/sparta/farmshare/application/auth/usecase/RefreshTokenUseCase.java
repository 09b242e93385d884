package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.auth.dto.AuthResponse;
import com.sparta.farmshare.application.auth.service.TokenService;
import com.sparta.farmshare.common.util.HashUtils;
import com.sparta.farmshare.domain.auth.exception.AccountBannedException;
import com.sparta.farmshare.domain.auth.exception.InvalidRefreshTokenException;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import com.sparta.farmshare.infrastructure.security.JwtClaims;
import com.sparta.farmshare.infrastructure.security.JwtTokenProvider;
import com.sparta.farmshare.infrastructure.security.TokenType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Refresh Token 재발급 (Rotation)
 *
 * 저장된 해시와 다른 토큰이 들어오면 이미 교체된 토큰의 재사용으로 보고
 * 저장된 Refresh Token까지 폐기한다 (해당 사용자 재로그인 필요)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenUseCase {

    private final UserRepository userRepository;
    private final JwtTokenProvider jwtTokenProvider;
    private final TokenService tokenService;

    @Transactional(noRollbackFor = InvalidRefreshTokenException.class)
    public AuthResponse execute(String refreshToken) {
        JwtClaims claims = jwtTokenProvider.parse(refreshToken, TokenType.REFRESH)
                .orElseThrow(InvalidRefreshTokenException::new);

        User user = userRepository.findById(claims.userId())
                .orElseThrow(InvalidRefreshTokenException::new);

        if (!HashUtils.constantTimeEquals(user.getRefreshTokenHash(), HashUtils.sha256Hex(refreshToken))) {
            if (user.getRefreshTokenHash() != null) {
                log.warn("Refresh Token 재사용 감지, 세션 폐기 - userId={}", user.getUserId());
                user.clearRefreshToken();
            }
            throw new InvalidRefreshTokenException();
        }

        if (user.isBanned()) {
            throw new AccountBannedException();
        }

        return tokenService.issueTokens(user);
    }
}
