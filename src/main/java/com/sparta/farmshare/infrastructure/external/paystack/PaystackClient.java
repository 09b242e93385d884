package com.sparta.farmshare.infrastructure.external.paystack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.infrastructure.external.paystack.dto.PaystackBank;
import com.sparta.farmshare.infrastructure.external.paystack.dto.PaystackResponse;
import com.sparta.farmshare.infrastructure.external.paystack.dto.ResolvedAccount;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransactionData;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransactionInitialization;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransferData;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransferRecipient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Paystack REST API 클라이언트
 *
 * 조회성 호출(계좌 확인, 은행 목록, 상태 조회)만 재시도한다.
 * 재시도 대상: 5xx, 429, 네트워크 오류/타임아웃. 그 외 4xx는 즉시 실패
 * 이체 생성 / 결제 초기화는 중복 실행을 막기 위해 재시도하지 않는다.
 */
@Slf4j
@Component
public class PaystackClient {

    private static final String CURRENCY = "NGN";
    private static final String DEFAULT_TRANSFER_REASON = "FarmShare Escrow Release";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public PaystackClient(@Qualifier("paystackRestTemplate") RestTemplate restTemplate,
                          ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * 계좌번호 → 예금주명 조회
     * GET /bank/resolve
     */
    @Retryable(
            retryFor = {HttpServerErrorException.class, HttpClientErrorException.TooManyRequests.class,
                    ResourceAccessException.class},
            maxAttemptsExpression = "#{${app.paystack.max-retries:3} + 1}",
            backoff = @Backoff(delayExpression = "${app.paystack.retry-delay-ms:1000}", multiplier = 2)
    )
    public PaystackResponse<ResolvedAccount> resolveAccount(String accountNumber, String bankCode) {
        log.debug("[Paystack] 계좌 확인 요청 - bankCode={}", bankCode);
        return get("/bank/resolve?account_number={accountNumber}&bank_code={bankCode}",
                new ParameterizedTypeReference<PaystackResponse<ResolvedAccount>>() {}, accountNumber, bankCode);
    }

    /**
     * 나이지리아 은행 목록
     * GET /bank?country=nigeria
     */
    @Retryable(
            retryFor = {HttpServerErrorException.class, HttpClientErrorException.TooManyRequests.class,
                    ResourceAccessException.class},
            maxAttemptsExpression = "#{${app.paystack.bank-list-max-retries:2} + 1}",
            backoff = @Backoff(delayExpression = "${app.paystack.retry-delay-ms:1000}")
    )
    public List<PaystackBank> listBanks() {
        PaystackResponse<List<PaystackBank>> response = get("/bank?country=nigeria",
                new ParameterizedTypeReference<PaystackResponse<List<PaystackBank>>>() {});
        if (response == null || response.data() == null) {
            return List.of();
        }
        return response.data();
    }

    /**
     * 이체 수취인 등록
     * POST /transferrecipient
     */
    public TransferRecipient createTransferRecipient(String name, String accountNumber, String bankCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "nuban");
        body.put("name", name);
        body.put("account_number", accountNumber);
        body.put("bank_code", bankCode);
        body.put("currency", CURRENCY);

        PaystackResponse<TransferRecipient> response = post("/transferrecipient", body,
                new ParameterizedTypeReference<PaystackResponse<TransferRecipient>>() {});
        return requireData(response, "transfer recipient");
    }

    /**
     * 잔액에서 이체 실행
     * POST /transfer
     *
     * @param amountNaira 원 단위 금액 (요청은 kobo로 변환)
     */
    public TransferData initiateTransfer(String recipientCode, long amountNaira, String reference, String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("source", "balance");
        body.put("amount", toKobo(amountNaira));
        body.put("recipient", recipientCode);
        body.put("reason", reason != null && !reason.isBlank() ? reason : DEFAULT_TRANSFER_REASON);
        body.put("currency", CURRENCY);
        body.put("reference", reference);

        PaystackResponse<TransferData> response = post("/transfer", body,
                new ParameterizedTypeReference<PaystackResponse<TransferData>>() {});
        return requireData(response, "transfer");
    }

    /**
     * 이체 상태 조회
     * GET /transfer/verify/{reference}
     */
    @Retryable(
            retryFor = {HttpServerErrorException.class, HttpClientErrorException.TooManyRequests.class,
                    ResourceAccessException.class},
            maxAttemptsExpression = "#{${app.paystack.max-retries:3} + 1}",
            backoff = @Backoff(delayExpression = "${app.paystack.retry-delay-ms:1000}", multiplier = 2)
    )
    public TransferData verifyTransfer(String reference) {
        PaystackResponse<TransferData> response = get("/transfer/verify/{reference}",
                new ParameterizedTypeReference<PaystackResponse<TransferData>>() {}, reference);
        return requireData(response, "transfer verification");
    }

    /**
     * 결제 페이지 생성
     * POST /transaction/initialize
     */
    public TransactionInitialization initializeTransaction(String email, long amountNaira, String reference,
                                                           String callbackUrl, Map<String, Object> metadata) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", email);
        body.put("amount", toKobo(amountNaira));
        body.put("reference", reference);
        body.put("currency", CURRENCY);
        if (callbackUrl != null && !callbackUrl.isBlank()) {
            body.put("callback_url", callbackUrl);
        }
        if (metadata != null && !metadata.isEmpty()) {
            body.put("metadata", metadata);
        }

        PaystackResponse<TransactionInitialization> response = post("/transaction/initialize", body,
                new ParameterizedTypeReference<PaystackResponse<TransactionInitialization>>() {});
        return requireData(response, "transaction initialization");
    }

    /**
     * 결제 결과 조회
     * GET /transaction/verify/{reference}
     */
    @Retryable(
            retryFor = {HttpServerErrorException.class, HttpClientErrorException.TooManyRequests.class,
                    ResourceAccessException.class},
            maxAttemptsExpression = "#{${app.paystack.max-retries:3} + 1}",
            backoff = @Backoff(delayExpression = "${app.paystack.retry-delay-ms:1000}", multiplier = 2)
    )
    public TransactionData verifyTransaction(String reference) {
        PaystackResponse<TransactionData> response = get("/transaction/verify/{reference}",
                new ParameterizedTypeReference<PaystackResponse<TransactionData>>() {}, reference);
        return requireData(response, "transaction verification");
    }

    /**
     * 오류 응답 본문의 message 필드 추출 (없으면 null)
     */
    public String extractProviderMessage(HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        if (body.isBlank()) {
            return null;
        }
        try {
            JsonNode message = objectMapper.readTree(body).get("message");
            return message != null && message.isTextual() ? message.asText() : null;
        } catch (JsonProcessingException parseError) {
            log.debug("[Paystack] 오류 응답 파싱 실패 - status={}", e.getStatusCode().value());
            return null;
        }
    }

    private <T> T get(String path, ParameterizedTypeReference<T> type, Object... uriVariables) {
        return restTemplate.exchange(path, HttpMethod.GET, null, type, uriVariables).getBody();
    }

    private <T> T post(String path, Object body, ParameterizedTypeReference<T> type) {
        return restTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(body), type).getBody();
    }

    private <T> T requireData(PaystackResponse<T> response, String operation) {
        if (response == null || !response.status() || response.data() == null) {
            String message = response != null && response.message() != null
                    ? response.message()
                    : "Empty " + operation + " response";
            throw new PaystackApiException(message);
        }
        return response.data();
    }

    private static long toKobo(long amountNaira) {
        return Math.multiplyExact(amountNaira, 100L);
    }
}
