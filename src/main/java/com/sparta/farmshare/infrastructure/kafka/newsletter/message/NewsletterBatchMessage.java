package com.sparta.farmshare.infrastructure.kafka.newsletter.message;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 뉴스레터 배치 발송 메시지
 * 본문은 담지 않고 campaignId로 조회한다
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class NewsletterBatchMessage {

    private Long campaignId;
    private int batchIndex;
    private int batchCount;
    private List<String> recipients;

    public boolean isLastBatch() {
        return batchIndex >= batchCount - 1;
    }
}
