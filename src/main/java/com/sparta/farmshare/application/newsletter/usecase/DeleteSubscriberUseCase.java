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

/**
 * 구독자 영구 삭제 (관리자)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeleteSubscriberUseCase {

    private final NewsletterSubscriberRepository subscriberRepository;

    @Transactional
    public MessageResponse execute(String rawEmail) {
        String email = EmailNormalizer.normalize(rawEmail);
        NewsletterSubscriber subscriber = subscriberRepository.findByEmail(email)
                .orElseThrow(SubscriberNotFoundException::new);

        subscriberRepository.delete(subscriber);
        log.info("뉴스레터 구독자 영구 삭제 - email={}", email);
        return MessageResponse.of("Subscriber permanently deleted.");
    }
}
