package com.parkalot.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEvent extends DomainEvent {

    public static final String AGGREGATE_TYPE = "booking";

    public static final String TYPE_CREATED = "BOOKING_CREATED";
    public static final String TYPE_CONFIRMED = "BOOKING_CONFIRMED";
    public static final String TYPE_CANCELLED = "BOOKING_CANCELLED";
    public static final String TYPE_COMPLETED = "BOOKING_COMPLETED";

    private Long bookingId;
    private Long spaceId;
    private Long renterId;
    private Long ownerId;
    private BigDecimal amount;
    private String cancelledBy;

    private BookingEvent(String eventType, Long bookingId, Long spaceId, Long renterId,
                         Long ownerId, BigDecimal amount, String cancelledBy) {
        super(eventType, AGGREGATE_TYPE, bookingId);
        this.bookingId = bookingId;
        this.spaceId = spaceId;
        this.renterId = renterId;
        this.ownerId = ownerId;
        this.amount = amount;
        this.cancelledBy = cancelledBy;
    }

    public static BookingEvent created(Long bookingId, Long spaceId, Long renterId,
                                       Long ownerId, BigDecimal totalPrice) {
        return new BookingEvent(TYPE_CREATED, bookingId, spaceId, renterId, ownerId, totalPrice, null);
    }

    public static BookingEvent confirmed(Long bookingId, Long spaceId, Long renterId, Long ownerId) {
        return new BookingEvent(TYPE_CONFIRMED, bookingId, spaceId, renterId, ownerId, null, null);
    }

    public static BookingEvent cancelled(Long bookingId, Long spaceId, Long renterId, Long ownerId,
                                         BigDecimal refundAmount, String cancelledBy) {
        return new BookingEvent(TYPE_CANCELLED, bookingId, spaceId, renterId, ownerId, refundAmount, cancelledBy);
    }

    /**
     * @param ownerPayout amount credited to the space owner
     */
    public static BookingEvent completed(Long bookingId, Long spaceId, Long renterId, Long ownerId,
                                         BigDecimal ownerPayout) {
        return new BookingEvent(TYPE_COMPLETED, bookingId, spaceId, renterId, ownerId, ownerPayout, null);
    }
}
