package com.sparta.farmshare.infrastructure.security;

import com.sparta.farmshare.common.config.properties.JwtProperties;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.entity.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * JWT 발급 / 검증 (HS256)
 *
 * 클레임: sub(userId), email, role, type(access|refresh), jti, iss
 * - Access Token: 15분
 * - Refresh Token: 7일
 */
@Slf4j
@Component
public class JwtTokenProvider {

    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_ROLE = "role";
    private static final String CLAIM_TYPE = "type";

    private final JwtProperties jwtProperties;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;

    public JwtTokenProvider(JwtProperties jwtProperties, Clock clock) {
        this.jwtProperties = jwtProperties;
        this.clock = clock;
        this.key = Keys.hmacShaKeyFor(jwtProperties.secret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .requireIssuer(jwtProperties.issuer())
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    public String createAccessToken(User user) {
        return createToken(user, TokenType.ACCESS, jwtProperties.accessTokenTtl());
    }

    public String createRefreshToken(User user) {
        return createToken(user, TokenType.REFRESH, jwtProperties.refreshTokenTtl());
    }

    public long getAccessTokenTtlSeconds() {
        return jwtProperties.accessTokenTtl().toSeconds();
    }

    /**
     * 서명, 만료, 발급자, 토큰 타입까지 검증
     * @return 검증 실패 시 empty
     */
    public Optional<JwtClaims> parse(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        try {
            Claims claims = parser.parseClaimsJws(token).getBody();
            TokenType type = TokenType.fromClaim(claims.get(CLAIM_TYPE, String.class));
            if (type != expectedType) {
                log.debug("토큰 타입 불일치 - expected={}, actual={}", expectedType, type);
                return Optional.empty();
            }

            return Optional.of(new JwtClaims(
                    claims.getSubject(),
                    claims.get(CLAIM_EMAIL, String.class),
                    Role.valueOf(claims.get(CLAIM_ROLE, String.class)),
                    type,
                    claims.getId(),
                    claims.getExpiration().toInstant()
            ));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT 검증 실패 - {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String createToken(User user, TokenType type, Duration ttl) {
        Instant now = clock.instant();

        return Jwts.builder()
                .setSubject(user.getUserId())
                .setIssuer(jwtProperties.issuer())
                .setId(UUID.randomUUID().toString())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().name())
                .claim(CLAIM_TYPE, type.getClaimValue())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(ttl)))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }
}
