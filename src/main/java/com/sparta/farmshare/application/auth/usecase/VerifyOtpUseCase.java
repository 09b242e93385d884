package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.auth.dto.AuthResponse;
import com.sparta.farmshare.application.auth.dto.VerifyOtpRequest;
import com.sparta.farmshare.application.auth.service.TokenService;
import com.sparta.farmshare.application.auth.support.OtpHasher;
import com.sparta.farmshare.application.security.service.SecurityService;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.domain.auth.entity.PendingSignup;
import com.sparta.farmshare.domain.auth.exception.InvalidOtpException;
import com.sparta.farmshare.domain.auth.exception.OtpExpiredException;
import com.sparta.farmshare.domain.auth.exception.PendingSignupNotFoundException;
import com.sparta.farmshare.domain.auth.repository.PendingSignupRepository;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.exception.DuplicateEmailException;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * OTP 인증 유스케이스 (PendingSignup → User 전환)
 *
 * 1. 잠금/분당 시도 제한 확인
 * 2. 가입 대기 요청 조회, 만료 확인
 * 3. OTP 불일치 → 실패 기록 (예외가 나도 커밋)
 * 4. 일치 → User 생성, 가입 대기 요청 삭제, 실패 기록 초기화, 토큰 발급
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerifyOtpUseCase {

    private final PendingSignupRepository pendingSignupRepository;
    private final UserRepository userRepository;
    private final SecurityService securityService;
    private final OtpHasher otpHasher;
    private final TokenService tokenService;
    private final Clock clock;

    @Transactional(noRollbackFor = InvalidOtpException.class)
    public AuthResponse execute(VerifyOtpRequest request, String ipAddress) {
        String email = EmailNormalizer.normalize(request.email());
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. 시도 제한
        securityService.checkOtpRateLimit(email);

        // 2. 가입 대기 요청 확인
        PendingSignup pendingSignup = pendingSignupRepository.findByEmail(email)
                .orElseThrow(PendingSignupNotFoundException::new);

        if (pendingSignup.isOtpExpired(now)) {
            throw new OtpExpiredException();
        }

        // 3. OTP 비교 (불일치 시 실패 횟수는 반드시 남긴다)
        if (!otpHasher.matches(request.otp(), pendingSignup.getOtpHash())) {
            securityService.recordFailedOtpAttempt(email, ipAddress);
            throw new InvalidOtpException();
        }

        // 4. 인증 완료 사용자 생성
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateEmailException();
        }
        User user = userRepository.save(pendingSignup.toVerifiedUser(now));
        pendingSignupRepository.delete(pendingSignup);
        securityService.clearOtpAttempts(email);

        log.info("이메일 인증 완료 - userId={}, email={}, role={}", user.getUserId(), email, user.getRole());

        // 5. 토큰 발급
        return tokenService.issueTokens(user);
    }
}
