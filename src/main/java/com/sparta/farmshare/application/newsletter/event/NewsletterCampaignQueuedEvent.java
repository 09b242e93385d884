package com.sparta.farmshare.application.newsletter.event;

import java.util.List;

/**
 * 캠페인 저장 후 배치 발행 요청
 *
 * @param batches 배치별 수신자 이메일
 */
public record NewsletterCampaignQueuedEvent(
        Long campaignId,
        List<List<String>> batches
) {
}
