package com.sparta.farmshare.application.bank.usecase;

import com.sparta.farmshare.application.bank.dto.BankServiceHealthResponse;
import com.sparta.farmshare.application.bank.service.PaystackVerificationService;
import com.sparta.farmshare.common.config.properties.PaystackProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 은행 확인 서비스 상태 점검
 * 키가 설정되어 있고 은행 목록을 받아올 수 있으면 정상 (목록은 캐시를 거친다)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckBankServiceHealthUseCase {

    private final PaystackVerificationService paystackVerificationService;
    private final PaystackProperties paystackProperties;

    public BankServiceHealthResponse execute() {
        if (!paystackProperties.isConfigured()) {
            log.warn("[Paystack] API 키 미설정 - 상태 점검 실패");
            return BankServiceHealthResponse.of(false);
        }
        boolean healthy = !paystackVerificationService.getSupportedBanks().isEmpty();
        return BankServiceHealthResponse.of(healthy);
    }
}
