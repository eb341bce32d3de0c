package com.parkalot.parking.dto.response;

import java.math.BigDecimal;

public record PaymentIntentResponse(
        Long paymentId,
        String paymentIntentId,
        String clientSecret,
        BigDecimal amount,
        String currency,
        String status,
        boolean testMode,
        BigDecimal platformFee,
        BigDecimal ownerPayout
) {
}
