package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.auth.event.PasswordResetRequestedEvent;
import com.sparta.farmshare.application.auth.support.SecureTokenGenerator;
import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.common.util.HashUtils;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 비밀번호 찾기 유스케이스
 * 계정 존재 여부와 관계없이 같은 응답을 준다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForgotPasswordUseCase {

    static final String GENERIC_MESSAGE =
            "If an account with that email exists, a password reset link has been sent.";
    private static final Duration RESET_TOKEN_TTL = Duration.ofHours(1);

    private final UserRepository userRepository;
    private final SecureTokenGenerator secureTokenGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public MessageResponse execute(String rawEmail) {
        String email = EmailNormalizer.normalize(rawEmail);

        userRepository.findByEmail(email)
                .filter(user -> !user.isBanned())
                .ifPresent(user -> {
                    String token = secureTokenGenerator.generate();
                    user.issueResetToken(HashUtils.sha256Hex(token), LocalDateTime.now(clock).plus(RESET_TOKEN_TTL));
                    eventPublisher.publishEvent(new PasswordResetRequestedEvent(email, user.getName(), token));
                    log.info("비밀번호 재설정 토큰 발급 - userId={}", user.getUserId());
                });

        return MessageResponse.of(GENERIC_MESSAGE);
    }
}
