package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 비밀번호 확인 값이 다를 때 발생하는 예외
 */
public class PasswordMismatchException extends BusinessException {
    public PasswordMismatchException() {
        super(ErrorCode.A015);
    }
}
