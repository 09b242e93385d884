package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.auth.dto.AuthResponse;
import com.sparta.farmshare.application.auth.dto.LoginRequest;
import com.sparta.farmshare.application.auth.service.TokenService;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.domain.auth.exception.AccountBannedException;
import com.sparta.farmshare.domain.auth.exception.AccountNotVerifiedException;
import com.sparta.farmshare.domain.auth.exception.InvalidCredentialsException;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 이메일 / 비밀번호 로그인 유스케이스
 * 없는 계정, OAuth 전용 계정, 비밀번호 불일치는 모두 같은 401로 응답
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginUseCase {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final Clock clock;

    @Transactional
    public AuthResponse execute(LoginRequest request) {
        String email = EmailNormalizer.normalize(request.email());

        User user = userRepository.findByEmail(email)
                .filter(User::hasPassword)
                .filter(found -> passwordEncoder.matches(request.password(), found.getPasswordHash()))
                .orElseThrow(() -> {
                    log.info("로그인 실패 - email={}", email);
                    return new InvalidCredentialsException();
                });

        if (user.isBanned()) {
            log.warn("정지된 계정 로그인 시도 - userId={}", user.getUserId());
            throw new AccountBannedException();
        }
        if (!user.isVerified()) {
            throw new AccountNotVerifiedException();
        }

        user.markActive(LocalDateTime.now(clock));
        log.info("로그인 성공 - userId={}", user.getUserId());
        return tokenService.issueTokens(user);
    }
}
