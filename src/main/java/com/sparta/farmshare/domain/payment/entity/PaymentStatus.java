package com.sparta.farmshare.domain.payment.entity;

public enum PaymentStatus {
    PENDING,
    SUCCESS,
    FAILED
}
