package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.auth.dto.SignupRequest;
import com.sparta.farmshare.application.auth.dto.SignupResponse;
import com.sparta.farmshare.application.auth.event.SignupOtpIssuedEvent;
import com.sparta.farmshare.application.auth.support.OtpCodeGenerator;
import com.sparta.farmshare.application.auth.support.OtpHasher;
import com.sparta.farmshare.common.config.properties.OtpProperties;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.domain.auth.entity.PendingSignup;
import com.sparta.farmshare.domain.auth.exception.InvalidSignupRoleException;
import com.sparta.farmshare.domain.auth.exception.PasswordMismatchException;
import com.sparta.farmshare.domain.auth.repository.PendingSignupRepository;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.exception.DuplicateEmailException;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 회원가입 유스케이스
 *
 * User는 아직 만들지 않고 PendingSignup만 저장한다.
 * OTP 메일은 커밋 이후 AuthMailEventListener가 발송
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignupUseCase {

    private final UserRepository userRepository;
    private final PendingSignupRepository pendingSignupRepository;
    private final PasswordEncoder passwordEncoder;
    private final OtpCodeGenerator otpCodeGenerator;
    private final OtpHasher otpHasher;
    private final OtpProperties otpProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public SignupResponse execute(SignupRequest request) {
        // 1. 입력 검증
        String email = EmailNormalizer.normalize(request.email());
        if (request.confirmPassword() != null && !request.confirmPassword().equals(request.password())) {
            throw new PasswordMismatchException();
        }
        Role role = request.role() == null ? Role.BUYER : request.role();
        if (!role.isSelfAssignable()) {
            throw new InvalidSignupRoleException();
        }

        // 2. 이미 가입된 이메일인지 확인
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateEmailException();
        }

        // 3. OTP 생성 (해시만 저장)
        LocalDateTime now = LocalDateTime.now(clock);
        String otp = otpCodeGenerator.generate();
        String otpHash = otpHasher.hash(otp);
        LocalDateTime otpExpiresAt = now.plus(otpProperties.ttl());
        String passwordHash = passwordEncoder.encode(request.password());

        // 4. 가입 대기 요청 저장 (같은 이메일이면 덮어쓰기)
        PendingSignup pendingSignup = pendingSignupRepository.findByEmail(email)
                .map(existing -> {
                    existing.overwrite(request.name().trim(), request.phone(), passwordHash, role, otpHash, otpExpiresAt);
                    return existing;
                })
                .orElseGet(() -> PendingSignup.builder()
                        .email(email)
                        .name(request.name().trim())
                        .phone(request.phone())
                        .passwordHash(passwordHash)
                        .role(role)
                        .otpHash(otpHash)
                        .otpExpiresAt(otpExpiresAt)
                        .createdAt(now)
                        .build());
        pendingSignupRepository.save(pendingSignup);

        // 5. 커밋 후 OTP 메일 발송
        eventPublisher.publishEvent(new SignupOtpIssuedEvent(
                email, pendingSignup.getName(), otp, otpProperties.ttl().toMinutes()));

        log.info("회원가입 요청 저장 - email={}, role={}", email, role);
        return new SignupResponse("Signup successful. Please check your email for the OTP.", email);
    }
}
