package com.sparta.farmshare.domain.user.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 이미 가입된 이메일로 가입을 시도할 때 발생하는 예외
 */
public class DuplicateEmailException extends BusinessException {
    public DuplicateEmailException() {
        super(ErrorCode.A007);
    }
}
