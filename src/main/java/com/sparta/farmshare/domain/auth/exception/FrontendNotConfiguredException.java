package com.sparta.farmshare.domain.auth.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * OAuth 리다이렉트 대상 프론트엔드 주소가 없을 때 발생하는 예외
 */
public class FrontendNotConfiguredException extends BusinessException {
    public FrontendNotConfiguredException() {
        super(ErrorCode.A016);
    }
}
