package com.sparta.farmshare.domain.newsletter.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;

public class CampaignNotFoundException extends BusinessException {
    public CampaignNotFoundException() {
        super(ErrorCode.N003);
    }
}
