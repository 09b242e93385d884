package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 정지된 계정으로 로그인할 때 발생하는 예외
 */
public class AccountBannedException extends BusinessException {
    public AccountBannedException() {
        super(ErrorCode.A002);
    }
}
