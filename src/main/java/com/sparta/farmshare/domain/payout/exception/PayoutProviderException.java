package com.sparta.farmshare.domain.payout.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * Paystack 이체 조회 실패 (502)
 */
public class PayoutProviderException extends BusinessException {
    public PayoutProviderException(Throwable cause) {
        super(ErrorCode.PO003, cause);
    }
}
