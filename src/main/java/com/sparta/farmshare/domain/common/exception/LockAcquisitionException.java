package com.sparta.farmshare.domain.common.exception;

/**
 * 분산 락 획득에 실패했을 때 발생하는 예외
 */
public class LockAcquisitionException extends BusinessException {
    public LockAcquisitionException() {
        super(ErrorCode.COMMON005);
    }

    public LockAcquisitionException(Throwable cause) {
        super(ErrorCode.COMMON005, cause);
    }
}
