package com.sparta.farmshare.application.newsletter.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record SendNewsletterRequest(
        @NotBlank(message = "Subject is required")
        @Size(max = 255)
        String subject,

        @NotBlank(message = "HTML content is required")
        String htmlContent,

        String textContent,

        List<String> targetTags,

        boolean testMode
) {
}
