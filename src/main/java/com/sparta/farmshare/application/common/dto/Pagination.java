package com.sparta.farmshare.application.common.dto;

import org.springframework.data.domain.Page;

/**
 * 목록 응답 공통 페이지 정보 (page는 1부터)
 */
public record Pagination(
        int page,
        int limit,
        long total,
        int totalPages,
        boolean hasMore
) {
    public static Pagination from(Page<?> page) {
        return new Pagination(
                page.getNumber() + 1,
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages(),
                page.hasNext()
        );
    }
}
