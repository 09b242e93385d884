package com.sparta.farmshare.application.payout.usecase;

import com.sparta.farmshare.application.common.dto.Pagination;
import com.sparta.farmshare.application.payout.dto.PayoutListResponse;
import com.sparta.farmshare.application.payout.dto.PayoutResponse;
import com.sparta.farmshare.domain.payout.entity.Payout;
import com.sparta.farmshare.domain.payout.entity.PayoutStatus;
import com.sparta.farmshare.domain.payout.repository.PayoutRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 정산 목록 조회 (최신순)
 */
@Service
@RequiredArgsConstructor
public class GetPayoutsUseCase {

    private final PayoutRepository payoutRepository;

    @Transactional(readOnly = true)
    public PayoutListResponse execute(int page, int limit, PayoutStatus status, String vendorId) {
        PageRequest pageRequest = PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<Payout> payouts = payoutRepository.search(status, vendorId, pageRequest);

        return new PayoutListResponse(
                payouts.map(PayoutResponse::from).getContent(),
                Pagination.from(payouts)
        );
    }
}
