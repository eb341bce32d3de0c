package com.parkalot.parking.dto.response;

import com.parkalot.parking.domain.BookingType;
import com.parkalot.parking.domain.Payment;
import com.parkalot.parking.domain.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PaymentResponse(
        Long paymentId,
        BookingType bookingType,
        Long bookingId,
        BigDecimal amount,
        String currency,
        String paymentIntentId,
        PaymentStatus status,
        String description,
        String failureReason,
        BigDecimal refundAmount,
        LocalDateTime refundedAt,
        LocalDateTime createdAt
) {
    public static PaymentResponse from(Payment payment) {
        return new PaymentResponse(
                payment.getId(),
                payment.getBookingType(),
                payment.getBookingId(),
                payment.getAmount(),
                payment.getCurrency(),
                payment.getProviderPaymentId(),
                payment.getStatus(),
                payment.getDescription(),
                payment.getFailureReason(),
                payment.getRefundAmount(),
                payment.getRefundedAt(),
                payment.getCreatedAt()
        );
    }
}
