package com.sparta.farmshare.application.payout.usecase;

import com.sparta.farmshare.application.payout.dto.PayoutResponse;
import com.sparta.farmshare.application.payout.service.PayoutService;
import com.sparta.farmshare.domain.payout.entity.Payout;
import com.sparta.farmshare.domain.payout.exception.PayoutNotFoundException;
import com.sparta.farmshare.domain.payout.exception.PayoutProviderException;
import com.sparta.farmshare.domain.payout.repository.PayoutRepository;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackApiException;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackClient;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransferData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.client.RestClientException;

/**
 * Paystack 이체 상태 조회 후 정산 상태 동기화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerifyPayoutUseCase {

    private final PayoutRepository payoutRepository;
    private final PaystackClient paystackClient;
    private final PayoutService payoutService;

    @Transactional
    public PayoutResponse execute(String reference) {
        Payout payout = payoutRepository.findByReference(reference)
                .orElseThrow(() -> new PayoutNotFoundException(reference));

        TransferData transfer;
        try {
            transfer = paystackClient.verifyTransfer(reference);
        } catch (RestClientException | PaystackApiException e) {
            log.error("[Payout] 이체 조회 실패 - reference={}", reference, e);
            throw new PayoutProviderException(e);
        }

        payoutService.reconcile(payout, transfer);
        return PayoutResponse.from(payout);
    }
}
