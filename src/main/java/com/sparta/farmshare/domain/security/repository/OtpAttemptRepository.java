package com.sparta.farmshare.domain.security.repository;

import com.sparta.farmshare.domain.security.entity.OtpAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

public interface OtpAttemptRepository extends JpaRepository<OtpAttempt, Long> {

    Optional<OtpAttempt> findByEmail(String email);

    void deleteByEmail(String email);

    /**
     * 오래된 실패 기록 정리 (잠금 중인 기록은 유지)
     */
    @Modifying
    @Query("DELETE FROM OtpAttempt a WHERE a.updatedAt < :cutoff AND (a.lockedUntil IS NULL OR a.lockedUntil < :now)")
    int deleteStale(@Param("cutoff") LocalDateTime cutoff, @Param("now") LocalDateTime now);
}
