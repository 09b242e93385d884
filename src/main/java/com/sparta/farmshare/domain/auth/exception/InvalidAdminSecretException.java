package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 관리자 가입 비밀키가 일치하지 않을 때 발생하는 예외
 */
public class InvalidAdminSecretException extends BusinessException {
    public InvalidAdminSecretException() {
        super(ErrorCode.A013);
    }
}
