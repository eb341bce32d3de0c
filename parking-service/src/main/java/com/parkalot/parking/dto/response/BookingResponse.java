package com.parkalot.parking.dto.response;

import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.domain.CancelledBy;
import com.parkalot.parking.domain.VehicleInfo;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record BookingResponse(
        Long bookingId,
        Long spaceId,
        Long renterId,
        Long ownerId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        VehicleResponse vehicle,
        BigDecimal totalPrice,
        BigDecimal platformFee,
        BigDecimal ownerPayout,
        BookingStatus bookingStatus,
        BookingPaymentStatus paymentStatus,
        boolean refundDue,
        CancelledBy cancelledBy,
        String cancellationReason,
        LocalDateTime cancelledAt,
        LocalDateTime checkInTime,
        LocalDateTime checkOutTime,
        String renterNotes,
        LocalDateTime createdAt
) {
    public record VehicleResponse(String registration, String make, String model, String color) {
    }

    public static BookingResponse from(Booking booking) {
        VehicleInfo vehicle = booking.getVehicle();
        return new BookingResponse(
                booking.getId(),
                booking.getSpaceId(),
                booking.getRenterId(),
                booking.getOwnerId(),
                booking.getStartTime(),
                booking.getEndTime(),
                vehicle != null
                        ? new VehicleResponse(vehicle.getRegistration(), vehicle.getMake(), vehicle.getModel(), vehicle.getColor())
                        : null,
                booking.getTotalPrice(),
                booking.getPlatformFee(),
                booking.getOwnerPayout(),
                booking.getBookingStatus(),
                booking.getPaymentStatus(),
                booking.isRefundDue(),
                booking.getCancelledBy(),
                booking.getCancellationReason(),
                booking.getCancelledAt(),
                booking.getCheckInTime(),
                booking.getCheckOutTime(),
                booking.getRenterNotes(),
                booking.getCreatedAt()
        );
    }
}
