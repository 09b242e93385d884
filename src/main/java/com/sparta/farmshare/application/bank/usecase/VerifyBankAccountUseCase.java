package com.sparta.farmshare.application.bank.usecase;

import com.sparta.farmshare.application.bank.dto.BankVerificationResponse;
import com.sparta.farmshare.application.bank.dto.BankVerificationResult;
import com.sparta.farmshare.application.bank.dto.VerifyBankRequest;
import com.sparta.farmshare.application.bank.service.PaystackVerificationService;
import com.sparta.farmshare.domain.bank.exception.BankServiceUnavailableException;
import com.sparta.farmshare.domain.bank.exception.BankVerificationFailedException;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.exception.UserNotFoundException;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 정산 계좌 확인 및 등록 유스케이스
 * 확인에 성공하면 계좌 정보를 저장하고 기존 Paystack 수취인 코드는 폐기한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerifyBankAccountUseCase {

    private final PaystackVerificationService paystackVerificationService;
    private final UserRepository userRepository;

    @Transactional
    public BankVerificationResponse execute(String userId, VerifyBankRequest request) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));

        BankVerificationResult result = paystackVerificationService.verifyBankAccount(
                request.accountNumber(), request.bankCode());

        if (!result.success()) {
            log.warn("계좌 확인 실패 - userId={}, error={}", userId, result.error());
            if (result.errorType() != null && result.errorType().isServiceFault()) {
                throw new BankServiceUnavailableException(result.message());
            }
            throw new BankVerificationFailedException(result.message());
        }

        user.registerBankAccount(result.accountNumber(), result.bankCode(), result.accountName());
        log.info("정산 계좌 등록 완료 - userId={}, bankCode={}", userId, result.bankCode());

        return BankVerificationResponse.from(result);
    }
}
