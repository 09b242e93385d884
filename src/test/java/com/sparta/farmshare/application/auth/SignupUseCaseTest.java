package com.sparta.farmshare.application.auth;

import com.sparta.farmshare.application.auth.dto.SignupRequest;
import com.sparta.farmshare.application.auth.dto.SignupResponse;
import com.sparta.farmshare.application.auth.event.SignupOtpIssuedEvent;
import com.sparta.farmshare.application.auth.support.OtpCodeGenerator;
import com.sparta.farmshare.application.auth.support.OtpHasher;
import com.sparta.farmshare.application.auth.usecase.SignupUseCase;
import com.sparta.farmshare.common.config.properties.OtpProperties;
import com.sparta.farmshare.domain.auth.entity.PendingSignup;
import com.sparta.farmshare.domain.auth.exception.InvalidSignupRoleException;
import com.sparta.farmshare.domain.auth.exception.PasswordMismatchException;
import com.sparta.farmshare.domain.auth.repository.PendingSignupRepository;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.exception.DuplicateEmailException;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("회원가입 UseCase 테스트")
class SignupUseCaseTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private UserRepository userRepository;

    @Mock
    private PendingSignupRepository pendingSignupRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private SignupUseCase signupUseCase;
    private OtpHasher otpHasher;

    @BeforeEach
    void setUp() {
        OtpProperties otpProperties = new OtpProperties(Duration.ofMinutes(10), 6, "otp-secret");
        otpHasher = new OtpHasher(otpProperties);
        signupUseCase = new SignupUseCase(userRepository, pendingSignupRepository, passwordEncoder,
                new OtpCodeGenerator(otpProperties), otpHasher, otpProperties, eventPublisher, CLOCK);
    }

    @Test
    @DisplayName("가입 요청은 PendingSignup으로 저장되고 OTP 이벤트가 발행된다")
    void 가입_대기_저장() {
        // given
        SignupRequest request = new SignupRequest(" Ada@FarmShare.ng ", "Ada Obi", "str0ngPassword",
                "str0ngPassword", null, Role.VENDOR);
        given(userRepository.existsByEmail("ada@farmshare.ng")).willReturn(false);
        given(pendingSignupRepository.findByEmail("ada@farmshare.ng")).willReturn(Optional.empty());

        // when
        SignupResponse response = signupUseCase.execute(request);

        // then
        assertThat(response.email()).isEqualTo("ada@farmshare.ng");

        ArgumentCaptor<PendingSignup> pendingCaptor = ArgumentCaptor.forClass(PendingSignup.class);
        verify(pendingSignupRepository).save(pendingCaptor.capture());
        PendingSignup saved = pendingCaptor.getValue();
        assertThat(saved.getRole()).isEqualTo(Role.VENDOR);
        assertThat(saved.getOtpExpiresAt()).isEqualTo(LocalDateTime.now(CLOCK).plusMinutes(10));
        assertThat(passwordEncoder.matches("str0ngPassword", saved.getPasswordHash())).isTrue();

        ArgumentCaptor<SignupOtpIssuedEvent> eventCaptor = ArgumentCaptor.forClass(SignupOtpIssuedEvent.class);
        verify(eventPublisher).publishEvent(eventCaptor.capture());
        String otp = eventCaptor.getValue().otp();
        assertThat(otp).hasSize(6).containsOnlyDigits();
        // 원문이 아닌 해시만 저장
        assertThat(saved.getOtpHash()).isNotEqualTo(otp);
        assertThat(otpHasher.matches(otp, saved.getOtpHash())).isTrue();
    }

    @Test
    @DisplayName("이미 가입된 이메일이면 409")
    void 중복_이메일() {
        // given
        SignupRequest request = new SignupRequest("ada@farmshare.ng", "Ada", "str0ngPassword", null, null, null);
        given(userRepository.existsByEmail("ada@farmshare.ng")).willReturn(true);

        // when & then
        assertThatThrownBy(() -> signupUseCase.execute(request))
                .isInstanceOf(DuplicateEmailException.class);
        verify(pendingSignupRepository, never()).save(any());
    }

    @Test
    @DisplayName("비밀번호 확인이 다르면 실패")
    void 비밀번호_불일치() {
        SignupRequest request = new SignupRequest("ada@farmshare.ng", "Ada", "str0ngPassword", "different1", null, null);

        assertThatThrownBy(() -> signupUseCase.execute(request))
                .isInstanceOf(PasswordMismatchException.class);
    }

    @Test
    @DisplayName("일반 가입으로 ADMIN 역할은 선택할 수 없다")
    void 관리자_역할_거부() {
        SignupRequest request = new SignupRequest("ada@farmshare.ng", "Ada", "str0ngPassword", null, null, Role.ADMIN);

        assertThatThrownBy(() -> signupUseCase.execute(request))
                .isInstanceOf(InvalidSignupRoleException.class);
    }
}
