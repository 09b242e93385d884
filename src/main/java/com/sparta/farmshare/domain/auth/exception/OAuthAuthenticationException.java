package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * Google 토큰 교환 또는 프로필 조회에 실패했을 때 발생하는 예외
 */
public class OAuthAuthenticationException extends BusinessException {
    public OAuthAuthenticationException() {
        super(ErrorCode.A014);
    }

    public OAuthAuthenticationException(Throwable cause) {
        super(ErrorCode.A014, cause);
    }
}
