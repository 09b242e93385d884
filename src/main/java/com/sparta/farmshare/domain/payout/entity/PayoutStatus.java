package com.sparta.farmshare.domain.payout.entity;

import java.util.Locale;

/**
 * 정산 이체 상태
 */
public enum PayoutStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    REVERSED;

    /**
     * Paystack 이체 상태 문자열 변환
     * 알 수 없는 값은 PROCESSING으로 취급 (조회로 다시 확인)
     */
    public static PayoutStatus fromProvider(String providerStatus) {
        if (providerStatus == null) {
            return PROCESSING;
        }
        return switch (providerStatus.toLowerCase(Locale.ROOT)) {
            case "success" -> COMPLETED;
            case "failed", "abandoned", "rejected" -> FAILED;
            case "reversed" -> REVERSED;
            default -> PROCESSING;
        };
    }

    public boolean isFinal() {
        return this == COMPLETED || this == FAILED || this == REVERSED;
    }

    /**
     * 최종 상태에서는 빠져나가지 않는다
     * 예외: 완료된 이체가 은행에서 반환되는 COMPLETED → REVERSED
     */
    public boolean canTransitionTo(PayoutStatus next) {
        if (this == next) {
            return false;
        }
        if (isFinal()) {
            return this == COMPLETED && next == REVERSED;
        }
        return true;
    }
}
