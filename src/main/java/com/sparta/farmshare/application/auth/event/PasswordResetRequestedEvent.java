package com.sparta.farmshare.application.auth.event;

public record PasswordResetRequestedEvent(
        String email,
        String name,
        String resetToken
) {
}
