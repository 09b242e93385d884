package com.sparta.farmshare.infrastructure.outbox;

/**
 * 정산 이벤트 발행 상태
 * PENDING → PUBLISHED, 재시도 한도를 넘기면 FAILED
 */
public enum EventStatus {
    PENDING,
    PUBLISHED,
    // 운영자가 payload를 보고 직접 재발행
    FAILED
}
