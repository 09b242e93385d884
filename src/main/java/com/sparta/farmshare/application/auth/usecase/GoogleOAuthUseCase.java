package com.sparta.farmshare.application.auth.usecase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.application.auth.dto.AuthResponse;
import com.sparta.farmshare.application.auth.dto.OAuthState;
import com.sparta.farmshare.application.auth.service.TokenService;
import com.sparta.farmshare.common.config.properties.FrontendProperties;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.domain.auth.exception.AccountBannedException;
import com.sparta.farmshare.domain.auth.exception.FrontendNotConfiguredException;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import com.sparta.farmshare.infrastructure.external.google.GoogleOAuthClient;
import com.sparta.farmshare.infrastructure.external.google.GoogleProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Google OAuth 로그인 / 가입 유스케이스
 *
 * 사용자 매칭 순서: googleId → 이메일(계정 연결) → 신규 생성(state의 역할)
 * 완료 후 프론트엔드 /oauth 로 토큰을 붙여 리다이렉트
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GoogleOAuthUseCase {

    private final GoogleOAuthClient googleOAuthClient;
    private final UserRepository userRepository;
    private final TokenService tokenService;
    private final FrontendProperties frontendProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public String authorizationUrl(Role role, String mode) {
        return googleOAuthClient.buildAuthorizationUrl(OAuthState.of(role, mode).encode(objectMapper));
    }

    /**
     * @return 프론트엔드 리다이렉트 URL
     */
    @Transactional
    public String handleCallback(String code, String rawState) {
        String frontendBaseUrl = frontendProperties.baseUrl();
        if (!StringUtils.hasText(frontendBaseUrl)) {
            log.error("[Google OAuth] FRONTEND_BASE_URL 미설정");
            throw new FrontendNotConfiguredException();
        }

        OAuthState state = OAuthState.decode(rawState, objectMapper);
        GoogleProfile profile = googleOAuthClient.fetchProfile(code);

        User user = findOrCreateUser(profile, state);
        if (user.isBanned()) {
            throw new AccountBannedException();
        }
        user.markActive(LocalDateTime.now(clock));

        AuthResponse tokens = tokenService.issueTokens(user);
        return UriComponentsBuilder.fromHttpUrl(frontendBaseUrl)
                .path("/oauth")
                .queryParam("token", tokens.accessToken())
                .queryParam("refreshToken", tokens.refreshToken())
                .build()
                .toUriString();
    }

    private User findOrCreateUser(GoogleProfile profile, OAuthState state) {
        String email = EmailNormalizer.normalize(profile.email());

        return userRepository.findByGoogleId(profile.id())
                .or(() -> userRepository.findByEmail(email).map(existing -> {
                    existing.linkGoogleAccount(profile.id(), profile.picture());
                    log.info("[Google OAuth] 기존 계정에 Google 연결 - userId={}", existing.getUserId());
                    return existing;
                }))
                .orElseGet(() -> {
                    User created = userRepository.save(User.builder()
                            .email(email)
                            .name(StringUtils.hasText(profile.name()) ? profile.name() : email)
                            .googleId(profile.id())
                            .avatarUrl(profile.picture())
                            .role(state.role())
                            .verified(true)
                            .build());
                    log.info("[Google OAuth] 신규 가입 - userId={}, role={}, mode={}",
                            created.getUserId(), created.getRole(), state.mode());
                    return created;
                });
    }
}
