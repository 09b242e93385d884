package com.sparta.farmshare.infrastructure.kafka.payout.message;

import com.sparta.farmshare.domain.payout.entity.Payout;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * payout-events 토픽 메시지 (Outbox payload)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PayoutEventMessage {

    private String eventType;
    private String reference;
    private String vendorId;
    private long netAmount;
    private String failureReason;
    private LocalDateTime occurredAt;

    public static PayoutEventMessage of(String eventType, Payout payout, LocalDateTime occurredAt) {
        return new PayoutEventMessage(
                eventType,
                payout.getReference(),
                payout.getVendorId(),
                payout.getNetAmount(),
                payout.getFailureReason(),
                occurredAt
        );
    }
}
