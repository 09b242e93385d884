package com.sparta.farmshare.domain.payout.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

public class PayoutNotFoundException extends BusinessException {
    public PayoutNotFoundException(String reference) {
        super(ErrorCode.PO001, "Payout not found: " + reference);
    }
}
