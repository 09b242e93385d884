package com.sparta.farmshare.application.bank.dto;

import com.sparta.farmshare.infrastructure.external.paystack.dto.PaystackBank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 지원 은행 (Redis 캐시 대상)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SupportedBank {

    private Long id;
    private String name;
    private String slug;
    private String code;
    private boolean active;

    public static SupportedBank from(PaystackBank bank) {
        return new SupportedBank(bank.id(), bank.name(), bank.slug(), bank.code(), bank.active());
    }
}
