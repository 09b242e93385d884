package com.sparta.farmshare.application.newsletter.dto;

import com.sparta.farmshare.application.common.dto.Pagination;

import java.util.List;

public record SubscriberListResponse(
        List<SubscriberResponse> subscribers,
        Pagination pagination
) {
}
