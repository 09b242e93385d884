package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * Access Token이 유효하지 않을 때 발생하는 예외
 */
public class InvalidTokenException extends BusinessException {
    public InvalidTokenException() {
        super(ErrorCode.A011);
    }
}
