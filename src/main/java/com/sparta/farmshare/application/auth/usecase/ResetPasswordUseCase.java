package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.auth.dto.ResetPasswordRequest;
import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.common.util.HashUtils;
import com.sparta.farmshare.domain.auth.exception.InvalidResetTokenException;
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
 * 비밀번호 재설정 유스케이스
 * 성공하면 재설정 토큰과 Refresh Token 모두 폐기
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResetPasswordUseCase {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Transactional
    public MessageResponse execute(ResetPasswordRequest request) {
        String email = EmailNormalizer.normalize(request.email());
        LocalDateTime now = LocalDateTime.now(clock);

        User user = userRepository.findByEmail(email)
                .filter(found -> found.isResetTokenValid(HashUtils.sha256Hex(request.token()), now))
                .orElseThrow(InvalidResetTokenException::new);

        user.resetPassword(passwordEncoder.encode(request.newPassword()));

        log.info("비밀번호 재설정 완료 - userId={}", user.getUserId());
        return MessageResponse.of("Password has been reset successfully. Please log in with your new password.");
    }
}
