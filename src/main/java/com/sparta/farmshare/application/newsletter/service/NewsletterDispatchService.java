package com.sparta.farmshare.application.newsletter.service;

import com.sparta.farmshare.domain.newsletter.entity.NewsletterCampaign;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterCampaignRepository;
import com.sparta.farmshare.infrastructure.mail.EmailSendException;
import com.sparta.farmshare.infrastructure.mail.EmailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 배치 단위 뉴스레터 발송
 *
 * 수신자 한 명의 실패는 failedCount 로만 집계하고 나머지 발송을 계속한다.
 * 결과 집계는 원자적 UPDATE 이므로 같은 캠페인의 배치가 동시에 처리되어도 합계가 맞다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NewsletterDispatchService {

    private final NewsletterCampaignRepository campaignRepository;
    private final EmailService emailService;
    private final Clock clock;

    @Transactional
    public void processBatch(Long campaignId, List<String> recipients) {
        NewsletterCampaign campaign = campaignRepository.findById(campaignId).orElse(null);
        if (campaign == null) {
            log.warn("[Newsletter] 캠페인 없음 - 배치 무시, campaignId={}", campaignId);
            return;
        }

        int sent = 0;
        int failed = 0;
        for (String recipient : recipients) {
            if (sendOne(campaign, recipient)) {
                sent++;
            } else {
                failed++;
            }
        }

        campaignRepository.addBatchResult(campaignId, sent, failed);
        if (campaignRepository.completeIfFinished(campaignId, LocalDateTime.now(clock)) > 0) {
            log.info("[Newsletter] 캠페인 발송 완료 - campaignId={}", campaignId);
        }
        log.info("[Newsletter] 배치 처리 - campaignId={}, sent={}, failed={}", campaignId, sent, failed);
    }

    private boolean sendOne(NewsletterCampaign campaign, String recipient) {
        try {
            return emailService.sendCustomEmail(recipient, campaign.getSubject(),
                    campaign.getHtmlContent(), campaign.getTextContent());
        } catch (EmailSendException e) {
            log.warn("[Newsletter] 발송 실패 - campaignId={}, recipient={}", campaign.getId(), recipient, e);
            return false;
        }
    }
}
