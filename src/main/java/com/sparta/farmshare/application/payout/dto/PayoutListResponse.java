package com.sparta.farmshare.application.payout.dto;

import com.sparta.farmshare.application.common.dto.Pagination;

import java.util.List;

public record PayoutListResponse(
        List<PayoutResponse> payouts,
        Pagination pagination
) {
}
