package com.sparta.farmshare.application.newsletter.usecase;

import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.common.util.EmailNormalizer;
import com.sparta.farmshare.domain.newsletter.entity.NewsletterSubscriber;
import com.sparta.farmshare.domain.newsletter.exception.SubscriberNotFoundException;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterSubscriberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class UnsubscribeNewsletterUseCase {

    private final NewsletterSubscriberRepository subscriberRepository;
    private final Clock clock;

    @Transactional
    public MessageResponse execute(String rawEmail) {
        String email = EmailNormalizer.normalize(rawEmail);
        NewsletterSubscriber subscriber = subscriberRepository.findByEmail(email)
                .orElseThrow(SubscriberNotFoundException::new);

        if (!subscriber.isActive()) {
            return MessageResponse.of("This email is already unsubscribed.");
        }

        subscriber.unsubscribe(LocalDateTime.now(clock));
        log.info("뉴스레터 구독 해지 - email={}", email);
        return MessageResponse.of("Successfully unsubscribed from our newsletter.");
    }
}
