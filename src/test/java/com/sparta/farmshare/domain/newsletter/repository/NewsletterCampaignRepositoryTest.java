package com.sparta.farmshare.domain.newsletter.repository;

import com.sparta.farmshare.RepositoryTestBase;
import com.sparta.farmshare.domain.newsletter.entity.CampaignStatus;
import com.sparta.farmshare.domain.newsletter.entity.NewsletterCampaign;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * NewsletterCampaignRepository 통합 테스트
 */
@DisplayName("NewsletterCampaignRepository 테스트")
class NewsletterCampaignRepositoryTest extends RepositoryTestBase {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Autowired
    private NewsletterCampaignRepository campaignRepository;

    @Test
    @DisplayName("배치 결과를 누적하고 마지막 배치에서 COMPLETED로 바뀐다")
    void addBatchResult_completeIfFinished() {
        // given
        Long id = campaignRepository.save(NewsletterCampaign.queue(
                "March harvest", "<p>hi</p>", null, List.of("farmers"), 120, 2, NOW)).getId();
        flushAndClear();

        // when
        campaignRepository.addBatchResult(id, 48, 2);
        int afterFirst = campaignRepository.completeIfFinished(id, NOW.plusMinutes(1));
        campaignRepository.addBatchResult(id, 70, 0);
        int afterSecond = campaignRepository.completeIfFinished(id, NOW.plusMinutes(2));

        // then
        assertThat(afterFirst).isZero();
        assertThat(afterSecond).isEqualTo(1);

        NewsletterCampaign campaign = campaignRepository.findById(id).orElseThrow();
        assertThat(campaign.getSentCount()).isEqualTo(118);
        assertThat(campaign.getFailedCount()).isEqualTo(2);
        assertThat(campaign.getCompletedBatches()).isEqualTo(2);
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.COMPLETED);
        assertThat(campaign.getCompletedAt()).isEqualTo(NOW.plusMinutes(2));
        assertThat(campaign.getTargetTagList()).containsExactly("farmers");
    }

    @Test
    @DisplayName("이미 완료된 캠페인은 다시 완료 처리하지 않는다")
    void completeIfFinished_이미완료() {
        // given
        Long id = campaignRepository.save(NewsletterCampaign.queue(
                "Empty", "<p>hi</p>", null, null, 0, 0, NOW)).getId();
        flushAndClear();

        // when
        int updated = campaignRepository.completeIfFinished(id, NOW.plusHours(1));

        // then
        assertThat(updated).isZero();
        assertThat(campaignRepository.findById(id).orElseThrow().getCompletedAt()).isEqualTo(NOW);
    }
}
