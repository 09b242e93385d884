package com.sparta.farmshare.application.newsletter.dto;

public record SubscribeResponse(
        String message,
        SubscriberResponse subscriber
) {
}
