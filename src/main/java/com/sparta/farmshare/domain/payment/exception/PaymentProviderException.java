package com.sparta.farmshare.domain.payment.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * Paystack 결제 초기화 / 조회 실패 (502)
 */
public class PaymentProviderException extends BusinessException {
    public PaymentProviderException(Throwable cause) {
        super(ErrorCode.PAY002, cause);
    }
}
