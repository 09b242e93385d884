package com.sparta.farmshare.infrastructure.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 로그아웃된 Access Token 블랙리스트 (Redis)
 * 키: blacklist:token:{jti}, TTL: 토큰 잔여 유효 시간
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenBlacklistService {

    private static final String TOKEN_BLACKLIST_PREFIX = "blacklist:token:";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    public void blacklist(String jti, String userId, Instant expiresAt) {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        if (remaining.isNegative() || remaining.isZero()) {
            return;
        }

        redisTemplate.opsForValue().set(TOKEN_BLACKLIST_PREFIX + jti, userId, remaining);
        log.debug("Access Token 블랙리스트 등록 - userId={}, ttl={}s", userId, remaining.toSeconds());
    }

    public boolean isBlacklisted(String jti) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(TOKEN_BLACKLIST_PREFIX + jti));
    }
}
