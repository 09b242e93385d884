package com.sparta.farmshare.domain.payment.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

public class PaymentNotFoundException extends BusinessException {
    public PaymentNotFoundException(String reference) {
        super(ErrorCode.PAY001, "Payment not found: " + reference);
    }
}
