package com.sparta.farmshare.application.newsletter.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record SubscribeRequest(
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email,

        @Size(max = 100)
        String name,

        @Size(max = 50)
        String source,

        List<@NotBlank @Size(max = 50) String> tags
) {
}
