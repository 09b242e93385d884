package com.sparta.farmshare.application.auth;

import com.sparta.farmshare.application.auth.dto.AdminSignupRequest;
import com.sparta.farmshare.application.auth.dto.AuthResponse;
import com.sparta.farmshare.application.auth.event.AdminSignedUpEvent;
import com.sparta.farmshare.application.auth.service.TokenService;
import com.sparta.farmshare.application.auth.usecase.AdminSignupUseCase;
import com.sparta.farmshare.common.config.properties.AdminProperties;
import com.sparta.farmshare.domain.auth.exception.InvalidAdminSecretException;
import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.exception.DuplicateEmailException;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("관리자 가입 UseCase 테스트")
class AdminSignupUseCaseTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private UserRepository userRepository;

    @Mock
    private TokenService tokenService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Test
    @DisplayName("비밀키가 맞으면 인증된 ADMIN 계정이 생성된다")
    void 관리자_가입_성공() {
        // given
        AdminSignupUseCase useCase = useCase("admin-secret");
        given(userRepository.existsByEmail("ops@farmshare.ng")).willReturn(false);
        given(userRepository.save(any(User.class))).willAnswer(invocation -> invocation.getArgument(0));
        AuthResponse tokens = new AuthResponse("access", "refresh", "Bearer", 900, null);
        given(tokenService.issueTokens(any(User.class))).willReturn(tokens);

        // when
        AuthResponse response = useCase.execute(request("admin-secret"));

        // then
        assertThat(response).isSameAs(tokens);

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertThat(captor.getValue().getRole()).isEqualTo(Role.ADMIN);
        assertThat(captor.getValue().isVerified()).isTrue();
        assertThat(captor.getValue().getEmail()).isEqualTo("ops@farmshare.ng");
        verify(eventPublisher).publishEvent(any(AdminSignedUpEvent.class));
    }

    @Test
    @DisplayName("비밀키가 틀리면 403")
    void 비밀키_불일치() {
        AdminSignupUseCase useCase = useCase("admin-secret");

        assertThatThrownBy(() -> useCase.execute(request("wrong-secret")))
                .isInstanceOf(InvalidAdminSecretException.class)
                .extracting(e -> ((BusinessException) e).getStatus()).isEqualTo(HttpStatus.FORBIDDEN);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("서버에 비밀키가 설정되지 않았으면 어떤 키로도 가입할 수 없다")
    void 비밀키_미설정() {
        AdminSignupUseCase unset = useCase(null);
        AdminSignupUseCase blank = useCase("  ");

        assertThatThrownBy(() -> unset.execute(request("")))
                .isInstanceOf(InvalidAdminSecretException.class);
        assertThatThrownBy(() -> blank.execute(request("  ")))
                .isInstanceOf(InvalidAdminSecretException.class);
        verify(userRepository, never()).existsByEmail(anyString());
    }

    @Test
    @DisplayName("이미 가입된 이메일이면 409")
    void 중복_이메일() {
        AdminSignupUseCase useCase = useCase("admin-secret");
        given(userRepository.existsByEmail("ops@farmshare.ng")).willReturn(true);

        assertThatThrownBy(() -> useCase.execute(request("admin-secret")))
                .isInstanceOf(DuplicateEmailException.class);
    }

    private AdminSignupUseCase useCase(String configuredKey) {
        return new AdminSignupUseCase(userRepository, new BCryptPasswordEncoder(4), tokenService,
                new AdminProperties(configuredKey), eventPublisher, CLOCK);
    }

    private AdminSignupRequest request(String adminSecretKey) {
        return new AdminSignupRequest("Ops@FarmShare.ng", "Ops Admin", "str0ngPassword", adminSecretKey);
    }
}
