package com.parkalot.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", ErrorType.VALIDATION, "Invalid input"),
    RESOURCE_NOT_FOUND(404, "C002", ErrorType.NOT_FOUND, "Resource not found"),
    INTERNAL_ERROR(500, "C003", ErrorType.FATAL, "Internal server error"),
    MISSING_USER(401, "C004", ErrorType.ACCESS_DENIED, "Acting user is required"),
    ACCESS_DENIED(403, "C005", ErrorType.ACCESS_DENIED, "Access denied"),

    // Space
    SPACE_NOT_FOUND(404, "S001", ErrorType.NOT_FOUND, "Space not found"),
    SPACE_NOT_ACTIVE(409, "S002", ErrorType.CONFLICT, "Space is not available for booking"),
    SPACE_HAS_ACTIVE_BOOKINGS(409, "S003", ErrorType.CONFLICT, "Cannot delete space with active bookings"),
    SPACE_HAS_BOOKING_HISTORY(409, "S004", ErrorType.CONFLICT, "Space has past bookings; pause it instead"),
    INVALID_SPACE_STATUS(409, "S005", ErrorType.CONFLICT, "Space status does not allow this change"),
    TOO_MANY_PHOTOS(400, "S006", ErrorType.VALIDATION, "Maximum 6 photos allowed"),

    // Booking
    INVALID_TIME_RANGE(400, "B001", ErrorType.VALIDATION, "End time must be after start time"),
    START_TIME_IN_PAST(400, "B002", ErrorType.VALIDATION, "Start time cannot be in the past"),
    INVALID_BOOKING_DURATION(400, "B003", ErrorType.VALIDATION, "Booking duration is outside the allowed range"),
    CANNOT_BOOK_OWN_SPACE(400, "B004", ErrorType.VALIDATION, "You cannot book your own space"),
    SPACE_UNAVAILABLE(409, "B005", ErrorType.CONFLICT, "Space is not available for the selected times"),
    BOOKING_NOT_FOUND(404, "B006", ErrorType.NOT_FOUND, "Booking not found"),
    INVALID_STATUS_TRANSITION(409, "B007", ErrorType.CONFLICT, "Booking status cannot be changed"),
    BOOKING_NOT_CANCELLABLE(409, "B008", ErrorType.CONFLICT, "Booking cannot be cancelled"),
    LOCK_ACQUISITION_FAILED(409, "B009", ErrorType.CONFLICT, "Space is being booked by another request, try again"),

    // Payment
    PAYMENT_NOT_FOUND(404, "P001", ErrorType.NOT_FOUND, "Payment not found"),
    PAYMENT_PROVIDER_ERROR(502, "P002", ErrorType.EXTERNAL_FAILURE, "Payment provider request failed, please retry"),
    PAYMENT_ALREADY_REFUNDED(409, "P003", ErrorType.CONFLICT, "Payment already refunded"),
    PAYMENT_NOT_REFUNDABLE(409, "P004", ErrorType.CONFLICT, "Payment cannot be refunded"),
    REFUND_FAILED(502, "P005", ErrorType.EXTERNAL_FAILURE, "Refund processing failed"),
    INVALID_WEBHOOK_SIGNATURE(400, "P006", ErrorType.VALIDATION, "Invalid webhook"),
    BOOKING_ALREADY_PAID(409, "P007", ErrorType.CONFLICT, "Booking is already paid");

    private final int status;
    private final String code;
    private final ErrorType type;
    private final String message;
}
