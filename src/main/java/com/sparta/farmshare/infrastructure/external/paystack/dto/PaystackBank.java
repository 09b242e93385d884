package com.sparta.farmshare.infrastructure.external.paystack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PaystackBank(
        Long id,
        String name,
        String slug,
        String code,
        String longcode,
        String gateway,
        boolean active
) {
}
