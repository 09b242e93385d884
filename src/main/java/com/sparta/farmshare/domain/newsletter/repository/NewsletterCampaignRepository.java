package com.sparta.farmshare.domain.newsletter.repository;

import com.sparta.farmshare.domain.newsletter.entity.NewsletterCampaign;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;

public interface NewsletterCampaignRepository extends JpaRepository<NewsletterCampaign, Long> {

    /**
     * 배치 결과 누적 (동시 소비자 간 lost update 방지)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE NewsletterCampaign c SET " +
            "c.sentCount = c.sentCount + :sent, " +
            "c.failedCount = c.failedCount + :failed, " +
            "c.completedBatches = c.completedBatches + 1, " +
            "c.status = com.sparta.farmshare.domain.newsletter.entity.CampaignStatus.SENDING " +
            "WHERE c.id = :id")
    int addBatchResult(@Param("id") Long id, @Param("sent") int sent, @Param("failed") int failed);

    /**
     * 모든 배치가 끝났으면 COMPLETED
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE NewsletterCampaign c SET " +
            "c.status = com.sparta.farmshare.domain.newsletter.entity.CampaignStatus.COMPLETED, " +
            "c.completedAt = :now " +
            "WHERE c.id = :id AND c.completedBatches >= c.batchCount " +
            "AND c.status <> com.sparta.farmshare.domain.newsletter.entity.CampaignStatus.COMPLETED")
    int completeIfFinished(@Param("id") Long id, @Param("now") LocalDateTime now);
}
