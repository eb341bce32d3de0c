package com.parkalot.parking.event.producer;

import com.parkalot.common.event.BookingEvent;
import com.parkalot.common.event.Topics;
import com.parkalot.parking.domain.Booking;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@RequiredArgsConstructor
public class BookingEventProducer {

    private final ResilientKafkaPublisher publisher;

    public void publishBookingCreated(Booking booking) {
        BookingEvent event = BookingEvent.created(
                booking.getId(), booking.getSpaceId(), booking.getRenterId(),
                booking.getOwnerId(), booking.getTotalPrice());
        publisher.publish(Topics.BOOKING_CREATED, key(booking), event, "booking-created");
    }

    public void publishBookingConfirmed(Booking booking) {
        BookingEvent event = BookingEvent.confirmed(
                booking.getId(), booking.getSpaceId(), booking.getRenterId(), booking.getOwnerId());
        publisher.publish(Topics.BOOKING_CONFIRMED, key(booking), event, "booking-confirmed");
    }

    public void publishBookingCancelled(Booking booking, BigDecimal refundAmount) {
        BookingEvent event = BookingEvent.cancelled(
                booking.getId(), booking.getSpaceId(), booking.getRenterId(), booking.getOwnerId(),
                refundAmount, booking.getCancelledBy() != null ? booking.getCancelledBy().getCode() : null);
        publisher.publish(Topics.BOOKING_CANCELLED, key(booking), event, "booking-cancelled");
    }

    public void publishBookingCompleted(Booking booking) {
        BookingEvent event = BookingEvent.completed(
                booking.getId(), booking.getSpaceId(), booking.getRenterId(),
                booking.getOwnerId(), booking.getOwnerPayout());
        publisher.publish(Topics.BOOKING_COMPLETED, key(booking), event, "booking-completed");
    }

    private String key(Booking booking) {
        return String.valueOf(booking.getSpaceId());
    }
}
