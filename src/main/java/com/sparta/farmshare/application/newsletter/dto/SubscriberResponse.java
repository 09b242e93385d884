package com.sparta.farmshare.application.newsletter.dto;

import com.sparta.farmshare.domain.newsletter.entity.NewsletterSubscriber;

import java.time.LocalDateTime;
import java.util.List;

public record SubscriberResponse(
        Long id,
        String email,
        String name,
        String source,
        List<String> tags,
        boolean active,
        LocalDateTime subscribedAt,
        LocalDateTime unsubscribedAt
) {
    public static SubscriberResponse from(NewsletterSubscriber subscriber) {
        return new SubscriberResponse(
                subscriber.getId(),
                subscriber.getEmail(),
                subscriber.getName(),
                subscriber.getSource(),
                List.copyOf(subscriber.getTags()),
                subscriber.isActive(),
                subscriber.getSubscribedAt(),
                subscriber.getUnsubscribedAt()
        );
    }
}
