package com.sparta.farmshare.application.newsletter.dto;

import java.math.BigDecimal;

/**
 * @param growthRate 최근 7일 신규 활성 구독자 / 전체 활성 구독자 × 100 (소수 둘째 자리)
 */
public record NewsletterStatsResponse(
        long totalActive,
        long totalInactive,
        long total,
        long recentSubscribers,
        BigDecimal growthRate
) {
}
