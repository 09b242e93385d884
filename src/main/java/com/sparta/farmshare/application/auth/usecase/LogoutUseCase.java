package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import com.sparta.farmshare.infrastructure.security.TokenBlacklistService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * 로그아웃 유스케이스
 * - 저장된 Refresh Token 폐기
 * - 현재 Access Token은 만료 시까지 블랙리스트 등록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogoutUseCase {

    private final UserRepository userRepository;
    private final TokenBlacklistService tokenBlacklistService;

    @Transactional
    public MessageResponse execute(String userId, String accessTokenId, Instant accessTokenExpiresAt) {
        userRepository.findById(userId).ifPresent(user -> user.clearRefreshToken());
        tokenBlacklistService.blacklist(accessTokenId, userId, accessTokenExpiresAt);

        log.info("로그아웃 - userId={}", userId);
        return MessageResponse.of("Logged out successfully");
    }
}
