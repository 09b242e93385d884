package com.sparta.farmshare.application.auth.event;

public record AdminSignedUpEvent(
        String email,
        String name
) {
}
