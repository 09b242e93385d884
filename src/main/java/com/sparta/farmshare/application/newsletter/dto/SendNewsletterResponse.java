package com.sparta.farmshare.application.newsletter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 테스트 모드: recipientCount / testRecipients / htmlPreview
 * 실제 발송: campaignId / totalRecipients / batchCount
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SendNewsletterResponse(
        String message,
        String subject,
        Integer recipientCount,
        List<String> testRecipients,
        String htmlPreview,
        Long campaignId,
        Integer totalRecipients,
        Integer batchCount
) {
    public static SendNewsletterResponse preview(String subject, int recipientCount,
                                                 List<String> testRecipients, String htmlPreview) {
        return new SendNewsletterResponse("Test mode - newsletter not sent", subject, recipientCount,
                testRecipients, htmlPreview, null, null, null);
    }

    public static SendNewsletterResponse queued(String subject, Long campaignId, int totalRecipients, int batchCount) {
        return new SendNewsletterResponse("Newsletter queued for delivery", subject, null,
                null, null, campaignId, totalRecipients, batchCount);
    }
}
