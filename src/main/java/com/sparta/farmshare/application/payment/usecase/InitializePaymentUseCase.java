package com.sparta.farmshare.application.payment.usecase;

import com.sparta.farmshare.application.payment.dto.InitializePaymentRequest;
import com.sparta.farmshare.application.payment.dto.InitializePaymentResponse;
import com.sparta.farmshare.application.security.service.SecurityService;
import com.sparta.farmshare.common.config.properties.PaystackProperties;
import com.sparta.farmshare.domain.payment.entity.PaymentTransaction;
import com.sparta.farmshare.domain.payment.exception.PaymentProviderException;
import com.sparta.farmshare.domain.payment.repository.PaymentTransactionRepository;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.exception.UserNotFoundException;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackApiException;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackClient;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransactionInitialization;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.util.UUID;

/**
 * Paystack 결제 페이지 생성 유스케이스
 *
 * 시간당 시도 횟수를 먼저 확인/기록하고, Paystack 실패는 연속 실패 카운트에 반영한다.
 * 실패 기록이 롤백되지 않도록 PaymentProviderException은 롤백 대상에서 제외
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InitializePaymentUseCase {

    private final SecurityService securityService;
    private final UserRepository userRepository;
    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PaystackClient paystackClient;
    private final PaystackProperties paystackProperties;
    private final Clock clock;

    @Transactional(noRollbackFor = PaymentProviderException.class)
    public InitializePaymentResponse execute(String userId, InitializePaymentRequest request) {
        securityService.checkPaymentRateLimit(userId);

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));

        securityService.recordPaymentInitiation(userId);

        String reference = "fs_pay_" + clock.millis() + "_" + UUID.randomUUID().toString().substring(0, 8);

        TransactionInitialization initialization;
        try {
            initialization = paystackClient.initializeTransaction(
                    user.getEmail(), request.amount(), reference,
                    paystackProperties.callbackUrl(), request.metadata());
        } catch (RestClientException | PaystackApiException e) {
            log.error("[Payment] 결제 초기화 실패 - userId={}, reference={}", userId, reference, e);
            securityService.recordPaymentFailure(userId);
            throw new PaymentProviderException(e);
        }

        paymentTransactionRepository.save(PaymentTransaction.pending(
                userId, user.getEmail(), reference, request.amount(),
                initialization.authorizationUrl(), initialization.accessCode()));

        log.info("[Payment] 결제 초기화 완료 - userId={}, reference={}, amount={}", userId, reference, request.amount());
        return new InitializePaymentResponse(initialization.authorizationUrl(), initialization.accessCode(), reference);
    }
}
