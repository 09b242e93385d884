package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.auth.dto.AdminSignupRequest;
import com.sparta.farmshare.application.auth.dto.AuthResponse;
import com.sparta.farmshare.application.auth.event.AdminSignedUpEvent;
import com.sparta.farmshare.application.auth.service.TokenService;
import com.sparta.farmshare.common.config.properties.AdminProperties;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.common.util.HashUtils;
import com.sparta.farmshare.domain.auth.exception.InvalidAdminSecretException;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.exception.DuplicateEmailException;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 관리자 가입 유스케이스
 * 설정된 관리자 비밀키가 없으면 항상 거부
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminSignupUseCase {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final AdminProperties adminProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public AuthResponse execute(AdminSignupRequest request) {
        String configuredKey = adminProperties.secretKey();
        if (!StringUtils.hasText(configuredKey)
                || !HashUtils.constantTimeEquals(configuredKey, request.adminSecretKey())) {
            log.warn("관리자 가입 비밀키 불일치 - email={}", request.email());
            throw new InvalidAdminSecretException();
        }

        String email = EmailNormalizer.normalize(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateEmailException();
        }

        User admin = userRepository.save(User.builder()
                .email(email)
                .name(request.name().trim())
                .passwordHash(passwordEncoder.encode(request.password()))
                .role(Role.ADMIN)
                .verified(true)
                .lastActiveAt(LocalDateTime.now(clock))
                .build());

        eventPublisher.publishEvent(new AdminSignedUpEvent(email, admin.getName()));
        log.info("관리자 가입 완료 - userId={}", admin.getUserId());

        return tokenService.issueTokens(admin);
    }
}
