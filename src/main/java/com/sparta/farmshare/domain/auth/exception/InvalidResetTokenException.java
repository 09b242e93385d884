package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 비밀번호 재설정 토큰이 유효하지 않을 때 발생하는 예외
 */
public class InvalidResetTokenException extends BusinessException {
    public InvalidResetTokenException() {
        super(ErrorCode.A009);
    }
}
