package com.sparta.farmshare.domain.user.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 사용자를 찾을 수 없을 때 발생하는 예외
 */
public class UserNotFoundException extends BusinessException {
    public UserNotFoundException() {
        super(ErrorCode.U001);
    }

    public UserNotFoundException(String userId) {
        super(ErrorCode.U001, "User not found: " + userId);
    }
}
