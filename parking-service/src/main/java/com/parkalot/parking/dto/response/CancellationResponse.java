package com.parkalot.parking.dto.response;

import java.math.BigDecimal;

/**
 * Outcome of a cancellation. {@code refundIssued} is false when no refund was due or the
 * provider refund failed; in the latter case the refund can be retried through the payment API.
 */
public record CancellationResponse(
        Long bookingId,
        BigDecimal refundAmount,
        boolean refundEligible,
        boolean refundIssued,
        String refundId
) {
}
