package com.sparta.farmshare.infrastructure.outbox.repository;

import com.sparta.farmshare.infrastructure.outbox.EventStatus;
import com.sparta.farmshare.infrastructure.outbox.entity.OutboxEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * 재시도 시각이 된 발행 대기 이벤트 (오래된 순)
     */
    @Query("SELECT e FROM OutboxEvent e WHERE e.status = :status AND e.nextRetryAt <= :now ORDER BY e.createdAt ASC")
    List<OutboxEvent> findDueEvents(@Param("status") EventStatus status,
                                    @Param("now") LocalDateTime now,
                                    Pageable pageable);

    List<OutboxEvent> findByAggregateTypeAndAggregateIdOrderByCreatedAtDesc(String aggregateType, String aggregateId);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM OutboxEvent e WHERE e.status = com.sparta.farmshare.infrastructure.outbox.EventStatus.PUBLISHED AND e.publishedAt < :cutoff")
    int deletePublishedBefore(@Param("cutoff") LocalDateTime cutoff);
}
