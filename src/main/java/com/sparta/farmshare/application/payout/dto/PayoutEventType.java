package com.sparta.farmshare.application.payout.dto;

import com.sparta.farmshare.domain.payout.entity.PayoutStatus;

import java.util.Optional;

/**
 * 판매자에게 알리는 정산 이벤트
 */
public enum PayoutEventType {
    PAYOUT_INITIATED("Payout initiated", "Your payout has been initiated and is on its way to your bank account."),
    PAYOUT_COMPLETED("Payout completed", "Your payout has been sent to your bank account."),
    PAYOUT_FAILED("Payout failed", "Your payout could not be completed. Our team will review it shortly."),
    PAYOUT_REVERSED("Payout reversed", "Your payout was reversed by the bank. Our team will contact you.");

    private final String subject;
    private final String statusLine;

    PayoutEventType(String subject, String statusLine) {
        this.subject = subject;
        this.statusLine = statusLine;
    }

    public String getSubject() {
        return subject;
    }

    public String getStatusLine() {
        return statusLine;
    }

    /**
     * 상태 변경에 대응하는 이벤트 (PROCESSING 전환은 알리지 않음)
     */
    public static Optional<PayoutEventType> forStatusChange(PayoutStatus status) {
        return switch (status) {
            case COMPLETED -> Optional.of(PAYOUT_COMPLETED);
            case FAILED -> Optional.of(PAYOUT_FAILED);
            case REVERSED -> Optional.of(PAYOUT_REVERSED);
            case PENDING, PROCESSING -> Optional.empty();
        };
    }

    /**
     * 최초 이체 요청 직후 상태에 대응하는 이벤트
     */
    public static PayoutEventType forInitiation(PayoutStatus status) {
        return forStatusChange(status).orElse(PAYOUT_INITIATED);
    }
}
