package com.sparta.farmshare.infrastructure.kafka.payout.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.application.payout.dto.PayoutEventType;
import com.sparta.farmshare.common.config.KafkaTopicConfig;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import com.sparta.farmshare.infrastructure.kafka.payout.message.PayoutEventMessage;
import com.sparta.farmshare.infrastructure.mail.EmailSendException;
import com.sparta.farmshare.infrastructure.mail.EmailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * 정산 상태 이벤트 → 판매자 메일 알림
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayoutEventConsumer {

    private final ObjectMapper objectMapper;
    private final UserRepository userRepository;
    private final EmailService emailService;

    @KafkaListener(
            topics = KafkaTopicConfig.PAYOUT_EVENTS,
            groupId = "farmshare-payout-notification-group",
            concurrency = "3"
    )
    public void consume(String payload) {
        PayoutEventMessage message;
        try {
            message = objectMapper.readValue(payload, PayoutEventMessage.class);
        } catch (JsonProcessingException e) {
            log.error("[Kafka Consumer] 정산 이벤트 역직렬화 실패 - payload 무시", e);
            return;
        }

        log.info("[Kafka Consumer] 정산 이벤트 수신 - reference={}, eventType={}",
                message.getReference(), message.getEventType());

        PayoutEventType eventType = PayoutEventType.valueOf(message.getEventType());

        userRepository.findById(message.getVendorId()).ifPresentOrElse(vendor -> {
            try {
                emailService.sendPayoutStatusEmail(
                        vendor.getEmail(),
                        vendor.getName(),
                        eventType.getSubject(),
                        eventType.getStatusLine(),
                        message.getNetAmount(),
                        message.getReference());
            } catch (EmailSendException e) {
                log.error("[Kafka Consumer] 정산 알림 메일 실패 - reference={}, 정산은 정상 처리됨",
                        message.getReference(), e);
            }
        }, () -> log.warn("[Kafka Consumer] 정산 알림 대상 판매자 없음 - vendorId={}", message.getVendorId()));
    }
}
