package com.sparta.farmshare.application.newsletter.usecase;

import com.sparta.farmshare.application.newsletter.dto.SubscribeRequest;
import com.sparta.farmshare.application.newsletter.dto.SubscribeResponse;
import com.sparta.farmshare.application.newsletter.dto.SubscriberResponse;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.domain.newsletter.entity.NewsletterSubscriber;
import com.sparta.farmshare.domain.newsletter.exception.AlreadySubscribedException;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterSubscriberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 뉴스레터 구독 유스케이스
 * - 신규: 생성 (source 기본값 footer)
 * - 해지했던 이메일: 재활성화
 * - 이미 활성: 409
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscribeNewsletterUseCase {

    private final NewsletterSubscriberRepository subscriberRepository;
    private final Clock clock;

    @Transactional
    public SubscribeResponse execute(SubscribeRequest request) {
        String email = EmailNormalizer.normalize(request.email());
        Optional<NewsletterSubscriber> existing = subscriberRepository.findByEmail(email);

        if (existing.isPresent()) {
            NewsletterSubscriber subscriber = existing.get();
            if (subscriber.isActive()) {
                throw new AlreadySubscribedException();
            }
            subscriber.reactivate(request.name(), request.source(), request.tags());
            log.info("뉴스레터 재구독 - email={}", email);
            return new SubscribeResponse("Welcome back! Your subscription has been reactivated.",
                    SubscriberResponse.from(subscriber));
        }

        NewsletterSubscriber subscriber = subscriberRepository.save(NewsletterSubscriber.subscribe(
                email, request.name(), request.source(), request.tags(), LocalDateTime.now(clock)));
        log.info("뉴스레터 신규 구독 - email={}, source={}", email, subscriber.getSource());

        return new SubscribeResponse("Successfully subscribed to our newsletter!",
                SubscriberResponse.from(subscriber));
    }
}
