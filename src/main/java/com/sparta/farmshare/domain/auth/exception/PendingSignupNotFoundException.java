package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 인증 대기 중인 가입 요청이 없을 때 발생하는 예외
 */
public class PendingSignupNotFoundException extends BusinessException {
    public PendingSignupNotFoundException() {
        super(ErrorCode.A006);
    }
}
