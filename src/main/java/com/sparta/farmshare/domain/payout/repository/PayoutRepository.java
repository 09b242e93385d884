package com.sparta.farmshare.domain.payout.repository;

import com.sparta.farmshare.domain.payout.entity.Payout;
import com.sparta.farmshare.domain.payout.entity.PayoutStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PayoutRepository extends JpaRepository<Payout, Long> {

    Optional<Payout> findByReference(String reference);

    /**
     * 상태 / 판매자 필터 (null이면 조건 제외)
     */
    @Query("SELECT p FROM Payout p " +
            "WHERE (:status IS NULL OR p.status = :status) " +
            "AND (:vendorId IS NULL OR p.vendorId = :vendorId)")
    Page<Payout> search(@Param("status") PayoutStatus status,
                        @Param("vendorId") String vendorId,
                        Pageable pageable);
}
