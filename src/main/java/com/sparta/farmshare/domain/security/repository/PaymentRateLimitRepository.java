package com.sparta.farmshare.domain.security.repository;

import com.sparta.farmshare.domain.security.entity.PaymentRateLimit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

public interface PaymentRateLimitRepository extends JpaRepository<PaymentRateLimit, Long> {

    Optional<PaymentRateLimit> findByUserId(String userId);

    /**
     * 지난 윈도우의 결제 시작 횟수 초기화
     */
    @Modifying
    @Query("UPDATE PaymentRateLimit p SET p.initiations = 0, p.windowStartedAt = :now " +
            "WHERE p.windowStartedAt < :windowStart AND p.initiations > 0")
    int resetExpiredWindows(@Param("windowStart") LocalDateTime windowStart, @Param("now") LocalDateTime now);
}
