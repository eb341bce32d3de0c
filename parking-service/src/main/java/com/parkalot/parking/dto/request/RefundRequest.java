package com.parkalot.parking.dto.request;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Identifies the payment by id or by intent id. Amount defaults to everything still refundable.
 */
public record RefundRequest(
        Long paymentId,
        String paymentIntentId,
        @Positive BigDecimal amount,
        @Size(max = 50) String reason
) {

    @AssertTrue(message = "paymentId or paymentIntentId is required")
    public boolean isPaymentIdentified() {
        return paymentId != null || (paymentIntentId != null && !paymentIntentId.isBlank());
    }
}
