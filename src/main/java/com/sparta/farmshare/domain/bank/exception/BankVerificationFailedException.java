package com.sparta.farmshare.domain.bank.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 계좌 확인 실패 (입력 오류, 존재하지 않는 계좌 등)
 */
public class BankVerificationFailedException extends BusinessException {
    public BankVerificationFailedException() {
        super(ErrorCode.B001);
    }

    public BankVerificationFailedException(String message) {
        super(ErrorCode.B001, message);
    }
}
