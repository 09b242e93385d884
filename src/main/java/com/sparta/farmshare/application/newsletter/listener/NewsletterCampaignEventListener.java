package com.sparta.farmshare.application.newsletter.listener;

import com.sparta.farmshare.application.newsletter.event.NewsletterCampaignQueuedEvent;
import com.sparta.farmshare.infrastructure.kafka.newsletter.producer.NewsletterKafkaProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 캠페인 커밋 이후에만 배치를 발행한다 (롤백된 캠페인은 발송되지 않음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NewsletterCampaignEventListener {

    private final NewsletterKafkaProducer newsletterKafkaProducer;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleCampaignQueued(NewsletterCampaignQueuedEvent event) {
        log.info("[이벤트 리스너] 뉴스레터 캠페인 수신 - campaignId={}, batchCount={}",
                event.campaignId(), event.batches().size());

        int batchCount = event.batches().size();
        for (int i = 0; i < batchCount; i++) {
            newsletterKafkaProducer.publishBatch(event.campaignId(), i, batchCount, event.batches().get(i));
        }
    }
}
