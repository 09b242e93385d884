package com.sparta.farmshare.application.newsletter.usecase;

import com.sparta.farmshare.application.newsletter.dto.SendNewsletterRequest;
import com.sparta.farmshare.application.newsletter.dto.SendNewsletterResponse;
import com.sparta.farmshare.application.newsletter.event.NewsletterCampaignQueuedEvent;
import com.sparta.farmshare.common.config.properties.NewsletterProperties;
import com.sparta.farmshare.domain.newsletter.entity.NewsletterCampaign;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterCampaignRepository;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterSubscriberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 뉴스레터 발송 유스케이스
 *
 * testMode: 대상 수와 미리보기만 반환 (발송 없음)
 * 실제 발송: 캠페인 저장 → 커밋 후 배치 단위로 Kafka 발행 → 즉시 응답
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SendNewsletterUseCase {

    static final int TEST_RECIPIENT_LIMIT = 5;
    static final int PREVIEW_LENGTH = 500;

    private final NewsletterSubscriberRepository subscriberRepository;
    private final NewsletterCampaignRepository campaignRepository;
    private final NewsletterProperties newsletterProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public SendNewsletterResponse execute(SendNewsletterRequest request) {
        List<String> recipients = resolveRecipients(request.targetTags());

        if (request.testMode()) {
            log.info("[Newsletter] 테스트 모드 - subject={}, recipients={}", request.subject(), recipients.size());
            return SendNewsletterResponse.preview(
                    request.subject(),
                    recipients.size(),
                    recipients.subList(0, Math.min(TEST_RECIPIENT_LIMIT, recipients.size())),
                    preview(request.htmlContent()));
        }

        List<List<String>> batches = partition(recipients, newsletterProperties.batchSize());
        NewsletterCampaign campaign = campaignRepository.save(NewsletterCampaign.queue(
                request.subject(), request.htmlContent(), request.textContent(), request.targetTags(),
                recipients.size(), batches.size(), LocalDateTime.now(clock)));

        if (!batches.isEmpty()) {
            eventPublisher.publishEvent(new NewsletterCampaignQueuedEvent(campaign.getId(), batches));
        }

        log.info("[Newsletter] 캠페인 등록 - campaignId={}, recipients={}, batches={}",
                campaign.getId(), recipients.size(), batches.size());
        return SendNewsletterResponse.queued(request.subject(), campaign.getId(), recipients.size(), batches.size());
    }

    private List<String> resolveRecipients(List<String> targetTags) {
        if (targetTags == null || targetTags.isEmpty()) {
            return subscriberRepository.findActiveEmails();
        }
        return subscriberRepository.findActiveEmailsByAnyTag(targetTags);
    }

    private static String preview(String html) {
        return html.substring(0, Math.min(PREVIEW_LENGTH, html.length())) + "...";
    }

    static List<List<String>> partition(List<String> recipients, int batchSize) {
        int size = Math.max(1, batchSize);
        List<List<String>> batches = new ArrayList<>();
        for (int from = 0; from < recipients.size(); from += size) {
            batches.add(new ArrayList<>(recipients.subList(from, Math.min(from + size, recipients.size()))));
        }
        return batches;
    }
}
