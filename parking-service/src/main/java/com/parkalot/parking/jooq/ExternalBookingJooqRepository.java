package com.parkalot.parking.jooq;

import lombok.RequiredArgsConstructor;
import org.jooq.DSLContext;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;

import static com.parkalot.parking.jooq.ParkingTables.AirportBookings;
import static com.parkalot.parking.jooq.ParkingTables.GarageReservations;
import static org.jooq.impl.DSL.coalesce;
import static org.jooq.impl.DSL.inline;
import static org.jooq.impl.DSL.when;
import static org.jooq.impl.DSL.val;

/**
 * Payment status updates for booking types whose lifecycle is owned elsewhere
 * (airport parking and garage reservations).
 */
@Repository
@RequiredArgsConstructor
@Transactional
public class ExternalBookingJooqRepository {

    static final String PAID = "paid";
    static final String PENDING = "pending";
    static final String CONFIRMED = "confirmed";
    static final String RESERVATION_ACTIVE = "active";
    static final String RESERVATION_CANCELLED = "cancelled";
    static final String RESERVATION_REFUNDED = "refunded";
    static final String RESERVATION_COMPLETED = "completed";

    private final DSLContext dsl;

    /**
     * Sets the airport booking's payment status when its current status is one of {@code allowedFrom}
     * (a missing status counts as pending). A paid booking still pending is confirmed.
     *
     * @return rows updated; 0 when the booking is absent or already past {@code allowedFrom}
     */
    public int updateAirportPaymentStatus(Long bookingId, String paymentStatus, String paymentIntentId,
                                          Collection<String> allowedFrom) {
        String confirmedIfPaid = PAID.equals(paymentStatus) ? CONFIRMED : PENDING;
        return dsl.update(AirportBookings.TABLE)
                .set(AirportBookings.PAYMENT_STATUS, paymentStatus)
                .set(AirportBookings.PAYMENT_INTENT_ID, coalesce(val(paymentIntentId, String.class), AirportBookings.PAYMENT_INTENT_ID))
                .set(AirportBookings.BOOKING_STATUS,
                        when(AirportBookings.BOOKING_STATUS.eq(inline(PENDING)), inline(confirmedIfPaid))
                                .otherwise(AirportBookings.BOOKING_STATUS))
                .where(AirportBookings.ID.eq(bookingId))
                .and(AirportBookings.PAYMENT_STATUS.in(allowedFrom).or(AirportBookings.PAYMENT_STATUS.isNull()))
                .execute();
    }

    /**
     * A paid garage reservation becomes active unless it has already ended.
     */
    public int activateGarageReservation(Long reservationId) {
        return dsl.update(GarageReservations.TABLE)
                .set(GarageReservations.STATUS, RESERVATION_ACTIVE)
                .where(GarageReservations.ID.eq(reservationId))
                .and(GarageReservations.STATUS.notIn(RESERVATION_CANCELLED, RESERVATION_REFUNDED, RESERVATION_COMPLETED))
                .execute();
    }
}
