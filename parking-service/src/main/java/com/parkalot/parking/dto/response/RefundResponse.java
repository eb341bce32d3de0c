package com.parkalot.parking.dto.response;

import com.parkalot.parking.domain.PaymentStatus;

import java.math.BigDecimal;

public record RefundResponse(Long paymentId, String refundId, BigDecimal refundAmount, PaymentStatus paymentStatus) {
}
