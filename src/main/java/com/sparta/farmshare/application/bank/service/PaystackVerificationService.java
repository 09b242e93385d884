package com.sparta.farmshare.application.bank.service;

import com.sparta.farmshare.application.bank.dto.BankVerificationError;
import com.sparta.farmshare.application.bank.dto.BankVerificationResult;
import com.sparta.farmshare.application.bank.dto.SupportedBank;
import com.sparta.farmshare.common.config.CacheConfig;
import com.sparta.farmshare.common.config.properties.PaystackProperties;
import com.sparta.farmshare.domain.bank.exception.BankVerificationFailedException;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackClient;
import com.sparta.farmshare.infrastructure.external.paystack.dto.PaystackBank;
import com.sparta.farmshare.infrastructure.external.paystack.dto.PaystackResponse;
import com.sparta.farmshare.infrastructure.external.paystack.dto.ResolvedAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Paystack 기반 나이지리아 은행 계좌 확인
 *
 * 입력 형식 오류만 예외(400)로 던지고, Paystack 호출 실패는 분류된 결과로 돌려준다.
 * 재시도는 PaystackClient에서 처리되므로 여기서 받는 예외는 재시도가 끝난 뒤의 최종 실패다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaystackVerificationService {

    private static final Pattern ACCOUNT_NUMBER_PATTERN = Pattern.compile("^\\d{10}$");
    private static final Pattern BANK_CODE_PATTERN = Pattern.compile("^\\d{3,6}$");

    private final PaystackClient paystackClient;
    private final PaystackProperties paystackProperties;

    public BankVerificationResult verifyBankAccount(String accountNumber, String bankCode) {
        if (!paystackProperties.isConfigured()) {
            log.error("[Paystack] API 키 미설정 - 계좌 확인 불가");
            return BankVerificationResult.failed(BankVerificationError.NOT_CONFIGURED,
                    "Bank verification service unavailable. Please contact support.");
        }

        validate(accountNumber, bankCode);

        try {
            log.info("[Paystack] 계좌 확인 시작 - accountNumber={}, bankCode={}", mask(accountNumber), bankCode);
            PaystackResponse<ResolvedAccount> response = paystackClient.resolveAccount(accountNumber, bankCode);

            if (response == null || !response.status() || response.data() == null
                    || !StringUtils.hasText(response.data().accountName())) {
                log.warn("[Paystack] 계좌 확인 응답 형식 오류 - accountNumber={}", mask(accountNumber));
                return BankVerificationResult.failed(BankVerificationError.INVALID_RESPONSE,
                        "Could not verify bank account. Please try again.");
            }

            String accountName = response.data().accountName();
            log.info("[Paystack] 계좌 확인 완료 - accountNumber={}", mask(accountNumber));
            return BankVerificationResult.verified(accountName, accountNumber, bankCode);

        } catch (RestClientException e) {
            return classify(e, accountNumber);
        }
    }

    /**
     * 지원 은행 목록 (bank code 기준 중복 제거, 먼저 나온 항목 유지)
     * 빈 목록은 캐시하지 않는다
     */
    @Cacheable(value = CacheConfig.SUPPORTED_BANKS, key = "'nigeria'", unless = "#result.isEmpty()")
    public List<SupportedBank> getSupportedBanks() {
        if (!paystackProperties.isConfigured()) {
            log.warn("[Paystack] API 키 미설정 - 은행 목록 조회 생략");
            return new ArrayList<>();
        }

        try {
            List<PaystackBank> banks = paystackClient.listBanks();

            Map<String, SupportedBank> unique = new LinkedHashMap<>();
            for (PaystackBank bank : banks) {
                unique.putIfAbsent(bank.code(), SupportedBank.from(bank));
            }

            log.info("[Paystack] 은행 목록 조회 완료 - {}건 (중복 {}건 제거)",
                    unique.size(), banks.size() - unique.size());
            return new ArrayList<>(unique.values());

        } catch (RestClientException e) {
            log.error("[Paystack] 은행 목록 조회 실패", e);
            return new ArrayList<>();
        }
    }

    private void validate(String accountNumber, String bankCode) {
        if (!StringUtils.hasText(accountNumber) || !StringUtils.hasText(bankCode)) {
            throw new BankVerificationFailedException("Account number and bank code are required");
        }
        if (!ACCOUNT_NUMBER_PATTERN.matcher(accountNumber).matches()) {
            throw new BankVerificationFailedException("Invalid account number format. Must be 10 digits.");
        }
        if (!BANK_CODE_PATTERN.matcher(bankCode).matches()) {
            throw new BankVerificationFailedException("Invalid bank code format");
        }
    }

    private BankVerificationResult classify(RestClientException e, String accountNumber) {
        log.error("[Paystack] 계좌 확인 실패 - accountNumber={}", mask(accountNumber), e);

        if (e instanceof HttpStatusCodeException statusException) {
            int status = statusException.getStatusCode().value();
            String providerMessage = paystackClient.extractProviderMessage(statusException);

            return switch (status) {
                case 400 -> BankVerificationResult.failed(BankVerificationError.BAD_REQUEST,
                        StringUtils.hasText(providerMessage) ? providerMessage : "Invalid request parameters");
                case 401 -> BankVerificationResult.failed(BankVerificationError.AUTHENTICATION_FAILED,
                        "Bank verification service authentication error");
                case 422 -> BankVerificationResult.failed(BankVerificationError.INVALID_ACCOUNT,
                        "Account number not found or invalid for the selected bank");
                case 429 -> BankVerificationResult.failed(BankVerificationError.RATE_LIMITED,
                        "Too many requests. Please try again in a moment.");
                case 500, 502, 503, 504 -> BankVerificationResult.failed(BankVerificationError.SERVICE_UNAVAILABLE,
                        "Bank verification service temporarily unavailable. Please try again later.");
                default -> BankVerificationResult.failed(BankVerificationError.PROVIDER_ERROR,
                        StringUtils.hasText(providerMessage) ? providerMessage : "Unknown error from Paystack",
                        "Bank verification failed. Please try again.");
            };
        }

        if (e instanceof ResourceAccessException
                && NestedExceptionUtils.getMostSpecificCause(e) instanceof SocketTimeoutException) {
            return BankVerificationResult.failed(BankVerificationError.TIMEOUT,
                    "Bank verification request timed out. Please try again.");
        }

        return BankVerificationResult.failed(BankVerificationError.UNKNOWN,
                StringUtils.hasText(e.getMessage()) ? e.getMessage() : BankVerificationError.UNKNOWN.getLabel(),
                "Bank verification service temporarily unavailable");
    }

    private static String mask(String accountNumber) {
        if (accountNumber == null || accountNumber.length() < 4) {
            return "****";
        }
        return "******" + accountNumber.substring(accountNumber.length() - 4);
    }
}
