package com.sparta.farmshare.infrastructure.outbox.publisher;

import com.sparta.farmshare.common.config.KafkaTopicConfig;
import com.sparta.farmshare.infrastructure.outbox.EventStatus;
import com.sparta.farmshare.infrastructure.outbox.entity.OutboxEvent;
import com.sparta.farmshare.infrastructure.outbox.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Outbox 이벤트를 Kafka로 옮기는 스케줄러
 *
 * 브로커 ack를 받은 이벤트만 PUBLISHED로 바꾼다.
 * 실패하면 Exponential Backoff 후 재시도하고 MAX_RETRY_COUNT를 넘기면 FAILED
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventPublisher {

    static final int MAX_RETRY_COUNT = 5;
    private static final int BATCH_SIZE = 100;
    private static final long SEND_TIMEOUT_SECONDS = 10L;
    private static final int RETENTION_DAYS = 30;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Clock clock;

    @Scheduled(fixedDelay = 5000)
    @Transactional
    public void publishPendingEvents() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<OutboxEvent> dueEvents = outboxEventRepository.findDueEvents(
                EventStatus.PENDING, now, PageRequest.of(0, BATCH_SIZE));

        if (dueEvents.isEmpty()) {
            return;
        }

        int successCount = 0;
        int failCount = 0;

        for (OutboxEvent event : dueEvents) {
            try {
                send(event);
                event.markAsPublished(LocalDateTime.now(clock));
                successCount++;
                log.debug("[Outbox] 발행 성공 - eventId={}, aggregateId={}, eventType={}",
                        event.getId(), event.getAggregateId(), event.getEventType());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handleFailure(event, e);
                failCount++;
                break;
            } catch (ExecutionException | TimeoutException | RuntimeException e) {
                handleFailure(event, e);
                failCount++;
            }
        }

        log.info("[Outbox] 발행 완료 - 성공: {}건, 실패: {}건", successCount, failCount);
    }

    /**
     * 매일 자정, 보관 기간이 지난 PUBLISHED 이벤트 삭제
     */
    @Scheduled(cron = "0 0 0 * * *")
    @Transactional
    public void cleanupPublishedEvents() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(RETENTION_DAYS);
        int deleted = outboxEventRepository.deletePublishedBefore(cutoff);
        log.info("[Outbox] 오래된 이벤트 정리 - {}건 삭제, cutoff={}", deleted, cutoff);
    }

    private void send(OutboxEvent event) throws InterruptedException, ExecutionException, TimeoutException {
        kafkaTemplate.send(topicOf(event), event.getAggregateId(), event.getPayload())
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private String topicOf(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case "PAYOUT" -> KafkaTopicConfig.PAYOUT_EVENTS;
            default -> throw new IllegalStateException("Unknown outbox aggregate type: " + event.getAggregateType());
        };
    }

    private void handleFailure(OutboxEvent event, Exception e) {
        event.recordFailure(e.getMessage(), LocalDateTime.now(clock));
        log.warn("[Outbox] 발행 실패 - eventId={}, retryCount={}, error={}",
                event.getId(), event.getRetryCount(), e.getMessage());

        if (!event.canRetry(MAX_RETRY_COUNT)) {
            event.markAsFailed();
            log.error("[Outbox] 발행 최종 실패 - eventId={}, aggregateId={}",
                    event.getId(), event.getAggregateId(), e);
        }
    }
}
