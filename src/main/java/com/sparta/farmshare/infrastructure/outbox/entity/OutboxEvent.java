package com.sparta.farmshare.infrastructure.outbox.entity;

import com.sparta.farmshare.infrastructure.outbox.EventStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outbox 이벤트
 * 정산 상태 변경과 같은 트랜잭션에 저장되고, 스케줄러가 Kafka로 옮긴다
 */
@Entity
@Table(name = "event_outbox", indexes = {
        @Index(name = "idx_outbox_status_retry", columnList = "status, next_retry_at"),
        @Index(name = "idx_outbox_aggregate", columnList = "aggregate_type, aggregate_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OutboxEvent {

    private static final long BASE_BACKOFF_SECONDS = 10L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;  // PAYOUT

    @Column(name = "aggregate_id", nullable = false)
    private String aggregateId;    // 정산 reference

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;      // PAYOUT_INITIATED, PAYOUT_COMPLETED ...

    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "next_retry_at", nullable = false)
    private LocalDateTime nextRetryAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    public static OutboxEvent pending(String aggregateType, String aggregateId, String eventType,
                                      String payload, LocalDateTime now) {
        return OutboxEvent.builder()
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .eventType(eventType)
                .payload(payload)
                .status(EventStatus.PENDING)
                .retryCount(0)
                .createdAt(now)
                .nextRetryAt(now)
                .build();
    }

    public void markAsPublished(LocalDateTime now) {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = now;
        this.errorMessage = null;
    }

    public void markAsFailed() {
        this.status = EventStatus.FAILED;
    }

    /**
     * 발행 실패 기록
     * 다음 시도까지 2^retryCount × 10초 대기 (20초 → 40초 → 80초 → 160초)
     */
    public void recordFailure(String errorMessage, LocalDateTime now) {
        this.retryCount++;
        this.errorMessage = errorMessage;
        this.nextRetryAt = now.plusSeconds((1L << retryCount) * BASE_BACKOFF_SECONDS);
    }

    public boolean canRetry(int maxRetryCount) {
        return this.retryCount < maxRetryCount && this.status == EventStatus.PENDING;
    }
}
