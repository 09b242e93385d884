package com.sparta.farmshare.infrastructure.kafka.newsletter.producer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.common.config.KafkaTopicConfig;
import com.sparta.farmshare.infrastructure.kafka.newsletter.message.NewsletterBatchMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 뉴스레터 배치 Kafka Producer
 *
 * 파티션 전략:
 * - 메시지 키: campaignId
 * - 같은 캠페인의 배치는 같은 파티션에서 순서대로 소비된다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NewsletterKafkaProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public void publishBatch(Long campaignId, int batchIndex, int batchCount, List<String> recipients) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(
                    new NewsletterBatchMessage(campaignId, batchIndex, batchCount, recipients));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("뉴스레터 배치 메시지 직렬화 실패", e);
        }

        kafkaTemplate.send(KafkaTopicConfig.NEWSLETTER_DISPATCH, String.valueOf(campaignId), payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("[Kafka Producer] 뉴스레터 배치 발행 실패 - campaignId: {}, batch: {}/{}",
                                campaignId, batchIndex + 1, batchCount, ex);
                    } else {
                        log.info("[Kafka Producer] 뉴스레터 배치 발행 성공 - campaignId: {}, batch: {}/{}, partition: {}",
                                campaignId, batchIndex + 1, batchCount, result.getRecordMetadata().partition());
                    }
                });
    }
}
