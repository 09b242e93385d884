package com.sparta.farmshare.application.auth;

import com.sparta.farmshare.application.auth.event.PasswordResetRequestedEvent;
import com.sparta.farmshare.application.auth.support.SecureTokenGenerator;
import com.sparta.farmshare.application.auth.usecase.ForgotPasswordUseCase;
import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.common.util.HashUtils;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("비밀번호 찾기 UseCase 테스트")
class ForgotPasswordUseCaseTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final String GENERIC_MESSAGE =
            "If an account with that email exists, a password reset link has been sent.";

    @Mock
    private UserRepository userRepository;

    @Mock
    private SecureTokenGenerator secureTokenGenerator;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ForgotPasswordUseCase forgotPasswordUseCase;

    @BeforeEach
    void setUp() {
        forgotPasswordUseCase = new ForgotPasswordUseCase(userRepository, secureTokenGenerator, eventPublisher, CLOCK);
    }

    @Test
    @DisplayName("가입된 이메일이면 1시간짜리 토큰 해시를 저장하고 원문 토큰으로 메일 이벤트를 발행한다")
    void 재설정_토큰_발급() {
        // given
        User user = user(false);
        given(userRepository.findByEmail("ada@farmshare.ng")).willReturn(Optional.of(user));
        given(secureTokenGenerator.generate()).willReturn("reset-token");

        // when
        MessageResponse response = forgotPasswordUseCase.execute(" ADA@farmshare.ng ");

        // then
        assertThat(response.message()).isEqualTo(GENERIC_MESSAGE);
        assertThat(user.isResetTokenValid(HashUtils.sha256Hex("reset-token"), LocalDateTime.now(CLOCK))).isTrue();
        assertThat(user.isResetTokenValid(HashUtils.sha256Hex("reset-token"),
                LocalDateTime.now(CLOCK).plusHours(1))).isFalse();

        ArgumentCaptor<PasswordResetRequestedEvent> captor = ArgumentCaptor.forClass(PasswordResetRequestedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().email()).isEqualTo("ada@farmshare.ng");
        assertThat(captor.getValue().resetToken()).isEqualTo("reset-token");
    }

    @Test
    @DisplayName("없는 이메일이어도 같은 메시지를 주고 메일은 보내지 않는다")
    void 없는_이메일() {
        // given
        given(userRepository.findByEmail("ghost@farmshare.ng")).willReturn(Optional.empty());

        // when
        MessageResponse response = forgotPasswordUseCase.execute("ghost@farmshare.ng");

        // then
        assertThat(response.message()).isEqualTo(GENERIC_MESSAGE);
        verify(secureTokenGenerator, never()).generate();
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("정지된 계정에는 재설정 메일을 보내지 않는다")
    void 정지_계정() {
        // given
        given(userRepository.findByEmail("ada@farmshare.ng")).willReturn(Optional.of(user(true)));

        // when
        MessageResponse response = forgotPasswordUseCase.execute("ada@farmshare.ng");

        // then
        assertThat(response.message()).isEqualTo(GENERIC_MESSAGE);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    private User user(boolean banned) {
        return User.builder()
                .userId("user-1")
                .email("ada@farmshare.ng")
                .name("Ada")
                .role(Role.BUYER)
                .verified(true)
                .banned(banned)
                .build();
    }
}
