package com.sparta.farmshare.infrastructure.kafka.newsletter.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.application.newsletter.service.NewsletterDispatchService;
import com.sparta.farmshare.common.config.KafkaTopicConfig;
import com.sparta.farmshare.common.config.properties.NewsletterProperties;
import com.sparta.farmshare.infrastructure.kafka.newsletter.message.NewsletterBatchMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * 뉴스레터 배치 소비
 * 배치 사이에 batchDelay 만큼 쉬어 메일 서버 발송 한도를 넘지 않게 한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NewsletterKafkaConsumer {

    private final ObjectMapper objectMapper;
    private final NewsletterDispatchService dispatchService;
    private final NewsletterProperties newsletterProperties;

    @KafkaListener(
            topics = KafkaTopicConfig.NEWSLETTER_DISPATCH,
            groupId = "farmshare-newsletter-dispatch-group",
            concurrency = "3"
    )
    public void consume(String payload) {
        NewsletterBatchMessage message;
        try {
            message = objectMapper.readValue(payload, NewsletterBatchMessage.class);
        } catch (JsonProcessingException e) {
            log.error("[Kafka Consumer] 뉴스레터 배치 역직렬화 실패 - payload 무시", e);
            return;
        }

        log.info("[Kafka Consumer] 뉴스레터 배치 수신 - campaignId={}, batch={}/{}, recipients={}",
                message.getCampaignId(), message.getBatchIndex() + 1, message.getBatchCount(),
                message.getRecipients().size());

        dispatchService.processBatch(message.getCampaignId(), message.getRecipients());

        if (!message.isLastBatch()) {
            pause();
        }
    }

    private void pause() {
        long delayMillis = newsletterProperties.batchDelay() == null ? 0 : newsletterProperties.batchDelay().toMillis();
        if (delayMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Kafka Consumer] 배치 간 대기 중 인터럽트");
        }
    }
}
