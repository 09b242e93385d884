package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 이메일 인증을 마치지 않은 계정으로 로그인할 때 발생하는 예외
 */
public class AccountNotVerifiedException extends BusinessException {
    public AccountNotVerifiedException() {
        super(ErrorCode.A003);
    }
}
