package com.sparta.farmshare.domain.payout.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

/**
 * 판매자가 아니거나 정산 계좌가 확인되지 않은 경우
 */
public class VendorNotEligibleException extends BusinessException {
    public VendorNotEligibleException(String message) {
        super(ErrorCode.PO002, message);
    }
}
