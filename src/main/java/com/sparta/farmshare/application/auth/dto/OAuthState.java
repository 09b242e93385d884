package com.sparta.farmshare.application.auth.dto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.domain.user.entity.Role;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * OAuth state 파라미터 (Base64 JSON {role, mode})
 * 해석할 수 없는 값은 BUYER / signup으로 본다
 */
@Slf4j
public record OAuthState(
        Role role,
        String mode
) {
    public static final String MODE_SIGNUP = "signup";
    public static final String MODE_LOGIN = "login";

    public static OAuthState of(Role role, String mode) {
        Role safeRole = role != null && role.isSelfAssignable() ? role : Role.BUYER;
        String safeMode = MODE_LOGIN.equals(mode) ? MODE_LOGIN : MODE_SIGNUP;
        return new OAuthState(safeRole, safeMode);
    }

    public static OAuthState defaults() {
        return new OAuthState(Role.BUYER, MODE_SIGNUP);
    }

    public String encode(ObjectMapper objectMapper) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(this);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("OAuth state serialization failed", e);
        }
    }

    public static OAuthState decode(String state, ObjectMapper objectMapper) {
        if (state == null || state.isBlank()) {
            return defaults();
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(state);
            OAuthState decoded = objectMapper.readValue(new String(json, StandardCharsets.UTF_8), OAuthState.class);
            return of(decoded.role(), decoded.mode());
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.warn("[Google OAuth] state 해석 실패, 기본값 사용 - {}", e.getMessage());
            return defaults();
        }
    }
}
