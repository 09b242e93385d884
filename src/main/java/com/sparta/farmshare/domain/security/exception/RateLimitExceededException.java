package com.sparta.farmshare.domain.security.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 시도 제한 / 잠금 상태에서 요청할 때 발생하는 예외 (429)
 */
public class RateLimitExceededException extends BusinessException {
    public RateLimitExceededException() {
        super(ErrorCode.S001);
    }

    public RateLimitExceededException(String message) {
        super(ErrorCode.S001, message);
    }
}
