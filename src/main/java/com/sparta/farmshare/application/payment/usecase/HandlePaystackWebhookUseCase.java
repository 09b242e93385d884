package com.sparta.farmshare.application.payment.usecase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.application.payout.service.PayoutService;
import com.sparta.farmshare.application.security.service.SecurityService;
import com.sparta.farmshare.common.config.properties.PaystackProperties;
import com.sparta.farmshare.common.util.HashUtils;
import com.sparta.farmshare.domain.payment.exception.InvalidWebhookSignatureException;
import com.sparta.farmshare.domain.payment.repository.PaymentTransactionRepository;
import com.sparta.farmshare.domain.payout.entity.PayoutStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Paystack 웹훅 처리 유스케이스
 *
 * 1. x-paystack-signature = HMAC-SHA512(raw body, secret key) 검증
 * 2. <event>:<data.id> 로 중복 수신 확인
 * 3. 이벤트별 상태 반영 후 같은 트랜잭션에서 처리 완료 기록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HandlePaystackWebhookUseCase {

    static final String PROVIDER = "paystack";

    private final PaystackProperties paystackProperties;
    private final SecurityService securityService;
    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PayoutService payoutService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public MessageResponse execute(String rawBody, String signature) {
        verifySignature(rawBody, signature);
        String normalizedSignature = signature.toLowerCase(Locale.ROOT);

        JsonNode root = parse(rawBody);
        String event = root.path("event").asText("");
        JsonNode data = root.path("data");
        String eventId = event + ":" + data.path("id").asText("");

        if (securityService.isWebhookProcessed(PROVIDER, eventId)) {
            log.warn("[Webhook] 중복 웹훅 무시 - eventId={}", eventId);
            return MessageResponse.of("Event already processed");
        }

        String reference = data.path("reference").asText(null);
        switch (event) {
            case "charge.success" -> handleChargeSuccess(reference, data);
            case "transfer.success" -> payoutService.applyTransferWebhook(reference, PayoutStatus.COMPLETED, null);
            case "transfer.failed" -> payoutService.applyTransferWebhook(reference, PayoutStatus.FAILED,
                    failureReason(data, "Transfer failed"));
            case "transfer.reversed" -> payoutService.applyTransferWebhook(reference, PayoutStatus.REVERSED,
                    failureReason(data, "Transfer reversed"));
            default -> log.info("[Webhook] 처리하지 않는 이벤트 - event={}", event);
        }

        securityService.markWebhookProcessed(PROVIDER, eventId, event, normalizedSignature);
        log.info("[Webhook] 처리 완료 - eventId={}", eventId);
        return MessageResponse.of("Webhook processed");
    }

    private void handleChargeSuccess(String reference, JsonNode data) {
        if (reference == null) {
            log.warn("[Webhook] charge.success에 reference 없음");
            return;
        }

        paymentTransactionRepository.findByReference(reference).ifPresentOrElse(payment -> {
            if (payment.isSuccessful()) {
                return;
            }
            Long amount = data.hasNonNull("amount") ? data.get("amount").asLong() : null;
            String gatewayResponse = data.path("gateway_response").asText(null);

            if (payment.matchesAmountInKobo(amount)) {
                payment.markSuccess(gatewayResponse, LocalDateTime.now(clock));
                securityService.clearPaymentFailures(payment.getUserId());
                log.info("[Webhook] 결제 성공 반영 - reference={}", reference);
            } else {
                payment.markFailed("Amount mismatch");
                log.warn("[Webhook] 결제 금액 불일치 - reference={}, expectedKobo={}, actualKobo={}",
                        reference, payment.getAmount() * 100L, amount);
            }
        }, () -> log.warn("[Webhook] reference에 해당하는 결제 없음 - reference={}", reference));
    }

    private void verifySignature(String rawBody, String signature) {
        if (!paystackProperties.isConfigured() || !StringUtils.hasText(signature) || rawBody == null) {
            log.warn("[Webhook] 서명 검증 불가 - 키 또는 서명 누락");
            throw new InvalidWebhookSignatureException();
        }

        String expected = HashUtils.hmacSha512Hex(paystackProperties.secretKey(), rawBody);
        if (!HashUtils.constantTimeEquals(expected, signature.toLowerCase(Locale.ROOT))) {
            log.warn("[Webhook] 서명 불일치");
            throw new InvalidWebhookSignatureException();
        }
    }

    private JsonNode parse(String rawBody) {
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed webhook payload", e);
        }
    }

    private static String failureReason(JsonNode data, String fallback) {
        String reason = data.path("reason").asText(null);
        return StringUtils.hasText(reason) ? reason : fallback;
    }
}
