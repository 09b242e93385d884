package com.sparta.farmshare.domain.bank.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 계좌 확인 서비스 장애 (키 미설정, 인증 실패, 타임아웃, Paystack 5xx)
 */
public class BankServiceUnavailableException extends BusinessException {
    public BankServiceUnavailableException(String message) {
        super(ErrorCode.B002, message);
    }
}
