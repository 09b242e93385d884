package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * OTP 유효 시간이 지났을 때 발생하는 예외
 */
public class OtpExpiredException extends BusinessException {
    public OtpExpiredException() {
        super(ErrorCode.A005);
    }
}
