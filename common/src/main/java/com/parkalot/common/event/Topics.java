package com.parkalot.common.event;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.List;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Topics {

    public static final String BOOKING_CREATED = "parkalot.booking.created";
    public static final String BOOKING_CONFIRMED = "parkalot.booking.confirmed";
    public static final String BOOKING_CANCELLED = "parkalot.booking.cancelled";
    public static final String BOOKING_COMPLETED = "parkalot.booking.completed";

    public static final String PAYMENT_SUCCEEDED = "parkalot.payment.succeeded";
    public static final String PAYMENT_FAILED = "parkalot.payment.failed";
    public static final String PAYMENT_REFUNDED = "parkalot.payment.refunded";

    public static final List<String> BOOKING_TOPICS =
            List.of(BOOKING_CREATED, BOOKING_CONFIRMED, BOOKING_CANCELLED, BOOKING_COMPLETED);
    public static final List<String> PAYMENT_TOPICS =
            List.of(PAYMENT_SUCCEEDED, PAYMENT_FAILED, PAYMENT_REFUNDED);

    public static final int PARTITIONS_BOOKING = 6;
    public static final int PARTITIONS_PAYMENT = 3;
}
