package com.sparta.farmshare.domain.newsletter.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * 뉴스레터 발송 캠페인
 * 배치별 발송 결과는 Repository의 원자적 UPDATE로 누적된다
 */
@Entity
@Table(name = "newsletter_campaigns")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NewsletterCampaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String subject;

    @Column(name = "html_content", columnDefinition = "MEDIUMTEXT", nullable = false)
    private String htmlContent;

    @Column(name = "text_content", columnDefinition = "MEDIUMTEXT")
    private String textContent;

    // 콤마 구분
    @Column(name = "target_tags")
    private String targetTags;

    @Column(name = "total_recipients", nullable = false)
    private int totalRecipients;

    @Column(name = "batch_count", nullable = false)
    private int batchCount;

    @Column(name = "completed_batches", nullable = false)
    private int completedBatches;

    @Column(name = "sent_count", nullable = false)
    private int sentCount;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CampaignStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public static NewsletterCampaign queue(String subject, String htmlContent, String textContent,
                                           Collection<String> targetTags, int totalRecipients, int batchCount,
                                           LocalDateTime now) {
        boolean empty = batchCount == 0;
        return NewsletterCampaign.builder()
                .subject(subject)
                .htmlContent(htmlContent)
                .textContent(textContent)
                .targetTags(targetTags == null || targetTags.isEmpty() ? null : String.join(",", targetTags))
                .totalRecipients(totalRecipients)
                .batchCount(batchCount)
                .status(empty ? CampaignStatus.COMPLETED : CampaignStatus.QUEUED)
                .createdAt(now)
                .completedAt(empty ? now : null)
                .build();
    }

    public List<String> getTargetTagList() {
        if (targetTags == null || targetTags.isBlank()) {
            return List.of();
        }
        return Arrays.asList(targetTags.split(","));
    }
}
