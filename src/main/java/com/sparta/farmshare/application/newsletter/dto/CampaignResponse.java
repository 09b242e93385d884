package com.sparta.farmshare.application.newsletter.dto;

import com.sparta.farmshare.domain.newsletter.entity.CampaignStatus;
import com.sparta.farmshare.domain.newsletter.entity.NewsletterCampaign;

import java.time.LocalDateTime;
import java.util.List;

public record CampaignResponse(
        Long id,
        String subject,
        List<String> targetTags,
        CampaignStatus status,
        int totalRecipients,
        int batchCount,
        int completedBatches,
        int sentCount,
        int failedCount,
        LocalDateTime createdAt,
        LocalDateTime completedAt
) {
    public static CampaignResponse from(NewsletterCampaign campaign) {
        return new CampaignResponse(
                campaign.getId(),
                campaign.getSubject(),
                campaign.getTargetTagList(),
                campaign.getStatus(),
                campaign.getTotalRecipients(),
                campaign.getBatchCount(),
                campaign.getCompletedBatches(),
                campaign.getSentCount(),
                campaign.getFailedCount(),
                campaign.getCreatedAt(),
                campaign.getCompletedAt()
        );
    }
}
