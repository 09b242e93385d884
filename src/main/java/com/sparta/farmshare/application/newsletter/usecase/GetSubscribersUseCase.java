package com.sparta.farmshare.application.newsletter.usecase;

import com.sparta.farmshare.application.common.dto.Pagination;
import com.sparta.farmshare.application.newsletter.dto.SubscriberListResponse;
import com.sparta.farmshare.application.newsletter.dto.SubscriberResponse;
import com.sparta.farmshare.domain.newsletter.entity.NewsletterSubscriber;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterSubscriberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 구독자 목록 (구독일 최신순)
 */
@Service
@RequiredArgsConstructor
public class GetSubscribersUseCase {

    private final NewsletterSubscriberRepository subscriberRepository;

    @Transactional(readOnly = true)
    public SubscriberListResponse execute(int page, int limit, boolean activeOnly) {
        PageRequest pageRequest = PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "subscribedAt"));

        Page<NewsletterSubscriber> subscribers = activeOnly
                ? subscriberRepository.findByActiveTrue(pageRequest)
                : subscriberRepository.findAll(pageRequest);

        return new SubscriberListResponse(
                subscribers.map(SubscriberResponse::from).getContent(),
                Pagination.from(subscribers)
        );
    }
}
