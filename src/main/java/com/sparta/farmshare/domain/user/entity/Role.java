package com.sparta.farmshare.domain.user.entity;

/**
 * 사용자 역할
 */
public enum Role {
    BUYER,
    VENDOR,
    ADMIN;

    /**
     * 일반 회원가입으로 선택 가능한 역할인지
     */
    public boolean isSelfAssignable() {
        return this == BUYER || this == VENDOR;
    }
}
