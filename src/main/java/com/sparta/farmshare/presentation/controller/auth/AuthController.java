package com.sparta.farmshare.presentation.controller.auth;

import com.sparta.farmshare.application.auth.dto.AuthResponse;
import com.sparta.farmshare.application.auth.dto.EmailRequest;
import com.sparta.farmshare.application.auth.dto.LoginRequest;
import com.sparta.farmshare.application.auth.dto.RefreshTokenRequest;
import com.sparta.farmshare.application.auth.dto.ResetPasswordRequest;
import com.sparta.farmshare.application.auth.dto.SignupRequest;
import com.sparta.farmshare.application.auth.dto.SignupResponse;
import com.sparta.farmshare.application.auth.dto.UserResponse;
import com.sparta.farmshare.application.auth.dto.VerifyOtpRequest;
import com.sparta.farmshare.application.auth.usecase.ForgotPasswordUseCase;
import com.sparta.farmshare.application.auth.usecase.GetMyProfileUseCase;
import com.sparta.farmshare.application.auth.usecase.GoogleOAuthUseCase;
import com.sparta.farmshare.application.auth.usecase.LoginUseCase;
import com.sparta.farmshare.application.auth.usecase.LogoutUseCase;
import com.sparta.farmshare.application.auth.usecase.RefreshTokenUseCase;
import com.sparta.farmshare.application.auth.usecase.ResendOtpUseCase;
import com.sparta.farmshare.application.auth.usecase.ResetPasswordUseCase;
import com.sparta.farmshare.application.auth.usecase.SignupUseCase;
import com.sparta.farmshare.application.auth.usecase.VerifyOtpUseCase;
import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.presentation.auth.AuthUser;
import com.sparta.farmshare.presentation.auth.Authenticated;
import com.sparta.farmshare.presentation.auth.LoginUser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

/**
 * 인증 API
 */
@Tag(name = "인증", description = "회원가입, OTP 인증, 로그인, 토큰 재발급, 비밀번호 재설정, Google OAuth")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthController {

    private final SignupUseCase signupUseCase;
    private final ResendOtpUseCase resendOtpUseCase;
    private final VerifyOtpUseCase verifyOtpUseCase;
    private final LoginUseCase loginUseCase;
    private final RefreshTokenUseCase refreshTokenUseCase;
    private final LogoutUseCase logoutUseCase;
    private final GetMyProfileUseCase getMyProfileUseCase;
    private final ForgotPasswordUseCase forgotPasswordUseCase;
    private final ResetPasswordUseCase resetPasswordUseCase;
    private final GoogleOAuthUseCase googleOAuthUseCase;

    /**
     * 회원가입 (OTP 메일 발송)
     * POST /api/auth/signup
     */
    @Operation(summary = "회원가입", description = "가입 정보를 저장하고 이메일로 OTP를 보냅니다")
    @PostMapping("/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(signupUseCase.execute(request));
    }

    /**
     * OTP 재발송
     * POST /api/auth/resend-otp
     */
    @Operation(summary = "OTP 재발송")
    @PostMapping("/resend-otp")
    public ResponseEntity<MessageResponse> resendOtp(@Valid @RequestBody EmailRequest request) {
        return ResponseEntity.ok(resendOtpUseCase.execute(request.email()));
    }

    /**
     * OTP 인증 → 계정 생성 + 토큰 발급
     * POST /api/auth/verify-otp
     */
    @Operation(summary = "OTP 인증", description = "OTP가 맞으면 계정을 만들고 토큰을 발급합니다")
    @PostMapping("/verify-otp")
    public ResponseEntity<AuthResponse> verifyOtp(@Valid @RequestBody VerifyOtpRequest request,
                                                  HttpServletRequest httpRequest) {
        return ResponseEntity.ok(verifyOtpUseCase.execute(request, httpRequest.getRemoteAddr()));
    }

    /**
     * 로그인
     * POST /api/auth/login
     */
    @Operation(summary = "로그인")
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(loginUseCase.execute(request));
    }

    /**
     * 토큰 재발급 (Refresh Token Rotation)
     * POST /api/auth/refresh
     */
    @Operation(summary = "토큰 재발급", description = "Refresh Token을 새 토큰 쌍으로 교체합니다")
    @PostMapping("/refresh")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(refreshTokenUseCase.execute(request.refreshToken()));
    }

    /**
     * 로그아웃
     * POST /api/auth/logout
     */
    @Operation(summary = "로그아웃")
    @Authenticated
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(@LoginUser AuthUser authUser) {
        return ResponseEntity.ok(logoutUseCase.execute(
                authUser.userId(), authUser.tokenId(), authUser.tokenExpiresAt()));
    }

    /**
     * 내 정보
     * GET /api/auth/me
     */
    @Operation(summary = "내 정보 조회")
    @Authenticated
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(@LoginUser AuthUser authUser) {
        return ResponseEntity.ok(getMyProfileUseCase.execute(authUser.userId()));
    }

    /**
     * 비밀번호 찾기
     * POST /api/auth/forgot-password
     */
    @Operation(summary = "비밀번호 찾기", description = "계정이 있으면 재설정 링크를 메일로 보냅니다")
    @PostMapping("/forgot-password")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody EmailRequest request) {
        return ResponseEntity.ok(forgotPasswordUseCase.execute(request.email()));
    }

    /**
     * 비밀번호 재설정
     * POST /api/auth/reset-password
     */
    @Operation(summary = "비밀번호 재설정")
    @PostMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return ResponseEntity.ok(resetPasswordUseCase.execute(request));
    }

    /**
     * Google 동의 화면으로 리다이렉트
     * GET /api/auth/google?role=VENDOR&mode=signup
     */
    @Operation(summary = "Google 로그인 시작")
    @GetMapping("/google")
    public ResponseEntity<Void> google(
            @Parameter(description = "가입 역할 (BUYER/VENDOR)")
            @RequestParam(required = false) Role role,
            @Parameter(description = "signup 또는 login")
            @RequestParam(required = false) String mode) {
        return redirect(googleOAuthUseCase.authorizationUrl(role, mode));
    }

    /**
     * Google 콜백 → 프론트엔드로 토큰 전달
     * GET /api/auth/google/callback
     */
    @Operation(summary = "Google 로그인 콜백")
    @GetMapping("/google/callback")
    public ResponseEntity<Void> googleCallback(@RequestParam String code,
                                               @RequestParam(required = false) String state) {
        return redirect(googleOAuthUseCase.handleCallback(code, state));
    }

    private ResponseEntity<Void> redirect(String location) {
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
    }
}
