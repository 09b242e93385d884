package com.sparta.farmshare.domain.newsletter.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 이미 구독 중인 이메일
 */
public class AlreadySubscribedException extends BusinessException {
    public AlreadySubscribedException() {
        super(ErrorCode.N001);
    }
}
