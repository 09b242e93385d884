package com.sparta.farmshare.domain.payment.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

public class InvalidWebhookSignatureException extends BusinessException {
    public InvalidWebhookSignatureException() {
        super(ErrorCode.PAY003);
    }
}
