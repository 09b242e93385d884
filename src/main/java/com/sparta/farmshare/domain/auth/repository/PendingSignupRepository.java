package com.sparta.farmshare.domain.auth.repository;

import com.sparta.farmshare.domain.auth.entity.PendingSignup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

public interface PendingSignupRepository extends JpaRepository<PendingSignup, String> {

    Optional<PendingSignup> findByEmail(String email);

    /**
     * OTP 만료 후 방치된 가입 요청 정리
     */
    @Modifying
    @Query("DELETE FROM PendingSignup p WHERE p.otpExpiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") LocalDateTime cutoff);
}
