package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 권한이 없는 리소스에 접근할 때 발생하는 예외
 */
public class ForbiddenException extends BusinessException {
    public ForbiddenException() {
        super(ErrorCode.A012);
    }
}
