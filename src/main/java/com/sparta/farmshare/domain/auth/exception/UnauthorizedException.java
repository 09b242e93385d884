package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 인증 헤더가 없을 때 발생하는 예외
 */
public class UnauthorizedException extends BusinessException {
    public UnauthorizedException() {
        super(ErrorCode.A010);
    }
}
