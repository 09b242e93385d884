package com.sparta.farmshare.application.payment.usecase;

import com.sparta.farmshare.application.payment.dto.PaymentResponse;
import com.sparta.farmshare.application.security.service.SecurityService;
import com.sparta.farmshare.domain.payment.entity.PaymentTransaction;
import com.sparta.farmshare.domain.payment.exception.PaymentNotFoundException;
import com.sparta.farmshare.domain.payment.exception.PaymentProviderException;
import com.sparta.farmshare.domain.payment.repository.PaymentTransactionRepository;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackApiException;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackClient;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransactionData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 결제 결과 확인 유스케이스
 * 이미 SUCCESS인 결제는 Paystack을 다시 조회하지 않는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerifyPaymentUseCase {

    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PaystackClient paystackClient;
    private final SecurityService securityService;
    private final Clock clock;

    @Transactional
    public PaymentResponse execute(String userId, String reference) {
        PaymentTransaction payment = paymentTransactionRepository.findByReference(reference)
                .filter(found -> found.isOwnedBy(userId))
                .orElseThrow(() -> new PaymentNotFoundException(reference));

        if (payment.isSuccessful()) {
            return PaymentResponse.from(payment);
        }

        TransactionData transaction;
        try {
            transaction = paystackClient.verifyTransaction(reference);
        } catch (RestClientException | PaystackApiException e) {
            log.error("[Payment] 결제 조회 실패 - reference={}", reference, e);
            throw new PaymentProviderException(e);
        }

        if (transaction.isSuccessful() && payment.matchesAmountInKobo(transaction.amount())) {
            payment.markSuccess(transaction.gatewayResponse(), LocalDateTime.now(clock));
            securityService.clearPaymentFailures(userId);
            log.info("[Payment] 결제 성공 - reference={}", reference);
        } else {
            payment.markFailed(transaction.gatewayResponse());
            securityService.recordPaymentFailure(userId);
            log.warn("[Payment] 결제 실패 - reference={}, providerStatus={}, amount={}",
                    reference, transaction.status(), transaction.amount());
        }

        return PaymentResponse.from(payment);
    }
}
