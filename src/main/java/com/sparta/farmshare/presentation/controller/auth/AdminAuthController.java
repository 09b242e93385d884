package com.sparta.farmshare.presentation.controller.auth;

import com.sparta.farmshare.application.auth.dto.AdminSignupRequest;
import com.sparta.farmshare.application.auth.dto.AuthResponse;
import com.sparta.farmshare.application.auth.usecase.AdminSignupUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 관리자 가입 API
 */
@Tag(name = "관리자 인증", description = "관리자 비밀키 기반 가입")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/auth")
public class AdminAuthController {

    private final AdminSignupUseCase adminSignupUseCase;

    /**
     * 관리자 가입
     * POST /api/admin/auth/signup
     */
    @Operation(summary = "관리자 가입", description = "ADMIN_SECRET_KEY가 일치해야 합니다")
    @PostMapping("/signup")
    public ResponseEntity<AuthResponse> signup(@Valid @RequestBody AdminSignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(adminSignupUseCase.execute(request));
    }
}
