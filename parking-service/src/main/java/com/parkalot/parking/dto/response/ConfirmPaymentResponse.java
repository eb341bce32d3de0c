package com.parkalot.parking.dto.response;

/**
 * @param status provider status of the intent; {@code succeeded} when the payment went through
 */
public record ConfirmPaymentResponse(String paymentIntentId, String status, boolean succeeded, boolean bookingConfirmed) {
}
