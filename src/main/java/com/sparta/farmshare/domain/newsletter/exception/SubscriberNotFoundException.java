package com.sparta.farmshare.domain.newsletter.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 구독자 목록에 없는 이메일
 */
public class SubscriberNotFoundException extends BusinessException {
    public SubscriberNotFoundException() {
        super(ErrorCode.N002);
    }
}
