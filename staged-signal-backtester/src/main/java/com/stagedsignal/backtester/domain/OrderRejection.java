package com.stagedsignal.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * An entry that was skipped or clamped by a resource limit. A clamp has a non-zero granted quantity
 * and still produced a trade.
 */
@Value
@Builder
public class OrderRejection {
    LocalDateTime timestamp;
    String ticker;
    RejectionReason reason;
    int requestedQuantity;
    int grantedQuantity;
    String detail;

    public boolean isClamp() {
        return grantedQuantity > 0;
    }
}
