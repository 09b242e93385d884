package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 일반 가입으로 ADMIN 역할을 요청할 때 발생하는 예외
 */
public class InvalidSignupRoleException extends BusinessException {
    public InvalidSignupRoleException() {
        super(ErrorCode.A017);
    }
}
