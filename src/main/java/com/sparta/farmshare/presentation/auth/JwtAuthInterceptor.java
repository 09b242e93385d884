package com.sparta.farmshare.presentation.auth;

import com.sparta.farmshare.domain.auth.exception.ForbiddenException;
import com.sparta.farmshare.domain.auth.exception.InvalidTokenException;
import com.sparta.farmshare.domain.auth.exception.UnauthorizedException;
import com.sparta.farmshare.infrastructure.security.JwtClaims;
import com.sparta.farmshare.infrastructure.security.JwtTokenProvider;
import com.sparta.farmshare.infrastructure.security.TokenBlacklistService;
import com.sparta.farmshare.infrastructure.security.TokenType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * @Authenticated / @AdminOnly 핸들러의 Bearer 토큰 검증
 *
 * 1. Authorization 헤더에서 토큰 추출 (없으면 401)
 * 2. 서명/만료/타입(access) 검증 (실패 시 401)
 * 3. 로그아웃 블랙리스트 확인 (401)
 * 4. @AdminOnly면 ADMIN 역할 확인 (403)
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthInterceptor implements HandlerInterceptor {

    public static final String AUTH_USER_ATTRIBUTE = "farmshare.authUser";
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider jwtTokenProvider;
    private final TokenBlacklistService tokenBlacklistService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }

        boolean adminOnly = hasAnnotation(handlerMethod, AdminOnly.class);
        if (!adminOnly && !hasAnnotation(handlerMethod, Authenticated.class)) {
            return true;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException();
        }

        JwtClaims claims = jwtTokenProvider.parse(header.substring(BEARER_PREFIX.length()).trim(), TokenType.ACCESS)
                .orElseThrow(InvalidTokenException::new);

        if (tokenBlacklistService.isBlacklisted(claims.jti())) {
            log.debug("블랙리스트 토큰 요청 거부 - userId={}", claims.userId());
            throw new InvalidTokenException();
        }

        AuthUser authUser = AuthUser.from(claims);
        if (adminOnly && !authUser.isAdmin()) {
            log.warn("관리자 API 접근 거부 - userId={}, uri={}", authUser.userId(), request.getRequestURI());
            throw new ForbiddenException();
        }

        request.setAttribute(AUTH_USER_ATTRIBUTE, authUser);
        return true;
    }

    private boolean hasAnnotation(HandlerMethod handlerMethod, Class<? extends java.lang.annotation.Annotation> type) {
        return handlerMethod.hasMethodAnnotation(type)
                || handlerMethod.getBeanType().isAnnotationPresent(type);
    }
}
