package com.sparta.farmshare.application.newsletter.usecase;

import com.sparta.farmshare.application.newsletter.dto.NewsletterStatsResponse;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterSubscriberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
public class GetNewsletterStatsUseCase {

    private static final int RECENT_DAYS = 7;

    private final NewsletterSubscriberRepository subscriberRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public NewsletterStatsResponse execute() {
        long totalActive = subscriberRepository.countByActive(true);
        long totalInactive = subscriberRepository.countByActive(false);
        long recent = subscriberRepository.countByActiveTrueAndSubscribedAtGreaterThanEqual(
                LocalDateTime.now(clock).minusDays(RECENT_DAYS));

        BigDecimal growthRate = totalActive == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(recent)
                        .multiply(BigDecimal.valueOf(100))
                        .divide(BigDecimal.valueOf(totalActive), 2, RoundingMode.HALF_UP);

        return new NewsletterStatsResponse(totalActive, totalInactive, totalActive + totalInactive,
                recent, growthRate);
    }
}
