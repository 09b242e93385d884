package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * OTP가 일치하지 않을 때 발생하는 예외
 */
public class InvalidOtpException extends BusinessException {
    public InvalidOtpException() {
        super(ErrorCode.A004);
    }
}
