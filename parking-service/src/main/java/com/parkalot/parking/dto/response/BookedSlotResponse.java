package com.parkalot.parking.dto.response;

import com.parkalot.parking.domain.Booking;

import java.time.LocalDateTime;

/**
 * A time slot taken on a space, without renter details.
 */
public record BookedSlotResponse(LocalDateTime startTime, LocalDateTime endTime) {

    public static BookedSlotResponse from(Booking booking) {
        return new BookedSlotResponse(booking.getStartTime(), booking.getEndTime());
    }
}
