package com.sparta.farmshare.application.payout.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.application.payout.dto.PayoutEventType;
import com.sparta.farmshare.domain.payout.entity.Payout;
import com.sparta.farmshare.domain.payout.entity.PayoutStatus;
import com.sparta.farmshare.domain.payout.repository.PayoutRepository;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackApiException;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackClient;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransferData;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransferRecipient;
import com.sparta.farmshare.infrastructure.kafka.payout.message.PayoutEventMessage;
import com.sparta.farmshare.infrastructure.outbox.entity.OutboxEvent;
import com.sparta.farmshare.infrastructure.outbox.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 정산 이체 처리와 상태 변경 이벤트 기록
 *
 * 이벤트는 Outbox 테이블에 저장되므로 호출자의 트랜잭션 안에서 불러야 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutService {

    static final String AGGREGATE_TYPE = "PAYOUT";

    private final PaystackClient paystackClient;
    private final PayoutRepository payoutRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 수취인 확보 후 Paystack 이체 요청
     * Paystack 오류는 예외로 올리지 않고 정산을 FAILED로 남긴다
     */
    public void requestTransfer(Payout payout, User vendor) {
        try {
            String recipientCode = ensureRecipient(vendor);
            payout.assignRecipient(recipientCode);

            TransferData transfer = paystackClient.initiateTransfer(
                    recipientCode, payout.getNetAmount(), payout.getReference(), payout.getReason());
            payout.applyProviderStatus(transfer.status(), transfer.transferCode(), LocalDateTime.now(clock));

            log.info("[Payout] 이체 요청 완료 - reference={}, status={}", payout.getReference(), payout.getStatus());

        } catch (RestClientException | PaystackApiException e) {
            log.error("[Payout] 이체 요청 실패 - reference={}", payout.getReference(), e);
            payout.markFailed(failureReasonOf(e), LocalDateTime.now(clock));
        }
    }

    /**
     * Paystack 조회 결과 반영
     *
     * @return 상태가 바뀌었으면 true
     */
    public boolean reconcile(Payout payout, TransferData transfer) {
        PayoutStatus before = payout.getStatus();
        boolean changed = payout.applyProviderStatus(transfer.status(), transfer.transferCode(),
                LocalDateTime.now(clock));
        if (changed) {
            log.info("[Payout] 상태 변경 - reference={}, {} -> {}", payout.getReference(), before, payout.getStatus());
            PayoutEventType.forStatusChange(payout.getStatus()).ifPresent(type -> recordEvent(payout, type));
        } else if (before.isFinal()) {
            log.debug("[Payout] 최종 상태라 조회 결과 무시 - reference={}, status={}, provider={}",
                    payout.getReference(), before, transfer.status());
        }
        return changed;
    }

    /**
     * 웹훅 transfer.* 이벤트 반영
     * 모르는 reference는 무시한다 (다른 시스템에서 만든 이체)
     */
    public void applyTransferWebhook(String reference, PayoutStatus target, String reason) {
        payoutRepository.findByReference(reference).ifPresentOrElse(payout -> {
            LocalDateTime now = LocalDateTime.now(clock);
            boolean changed = switch (target) {
                case COMPLETED -> payout.markCompleted(now);
                case FAILED -> payout.markFailed(reason, now);
                case REVERSED -> payout.markReversed(reason, now);
                default -> false;
            };
            if (changed) {
                log.info("[Payout] 웹훅 상태 반영 - reference={}, status={}", reference, target);
                PayoutEventType.forStatusChange(target).ifPresent(type -> recordEvent(payout, type));
            } else if (payout.getStatus() != target) {
                log.warn("[Payout] 순서가 어긋난 웹훅 무시 - reference={}, current={}, webhook={}",
                        reference, payout.getStatus(), target);
            }
        }, () -> log.warn("[Payout] 웹훅 reference에 해당하는 정산 없음 - reference={}", reference));
    }

    public void recordEvent(Payout payout, PayoutEventType eventType) {
        LocalDateTime now = LocalDateTime.now(clock);
        PayoutEventMessage message = PayoutEventMessage.of(eventType.name(), payout, now);
        try {
            String payload = objectMapper.writeValueAsString(message);
            outboxEventRepository.save(OutboxEvent.pending(
                    AGGREGATE_TYPE, payout.getReference(), eventType.name(), payload, now));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payout event: " + payout.getReference(), e);
        }
    }

    private String ensureRecipient(User vendor) {
        if (StringUtils.hasText(vendor.getPaystackRecipientCode())) {
            return vendor.getPaystackRecipientCode();
        }
        TransferRecipient recipient = paystackClient.createTransferRecipient(
                vendor.getAccountName() != null ? vendor.getAccountName() : vendor.getName(),
                vendor.getAccountNumber(),
                vendor.getBankCode());
        vendor.assignRecipientCode(recipient.recipientCode());
        log.info("[Payout] Paystack 수취인 등록 - vendorId={}", vendor.getUserId());
        return recipient.recipientCode();
    }

    private String failureReasonOf(RuntimeException e) {
        if (e instanceof HttpStatusCodeException statusException) {
            String providerMessage = paystackClient.extractProviderMessage(statusException);
            if (StringUtils.hasText(providerMessage)) {
                return providerMessage;
            }
        }
        return e.getMessage();
    }
}
