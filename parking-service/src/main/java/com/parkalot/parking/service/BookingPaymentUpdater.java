package com.parkalot.parking.service;

import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.BookingType;
import com.parkalot.parking.domain.Payment;
import com.parkalot.parking.jooq.ExternalBookingJooqRepository;
import com.parkalot.parking.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Propagates a payment outcome to the booking it pays for, whatever the booking type.
 * Runs inside the caller's transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPaymentUpdater {

    private static final Map<BookingPaymentStatus, Set<BookingPaymentStatus>> ALLOWED_FROM = Map.of(
            BookingPaymentStatus.PAID, EnumSet.of(BookingPaymentStatus.PENDING, BookingPaymentStatus.FAILED),
            BookingPaymentStatus.FAILED, EnumSet.of(BookingPaymentStatus.PENDING),
            BookingPaymentStatus.PARTIAL_REFUND, EnumSet.of(BookingPaymentStatus.PAID, BookingPaymentStatus.PARTIAL_REFUND),
            BookingPaymentStatus.REFUNDED, EnumSet.of(BookingPaymentStatus.PAID, BookingPaymentStatus.PARTIAL_REFUND),
            BookingPaymentStatus.PENDING, EnumSet.of(BookingPaymentStatus.PENDING, BookingPaymentStatus.FAILED));

    private final BookingRepository bookingRepository;
    private final ExternalBookingJooqRepository externalBookingJooqRepository;

    /**
     * @return the customer space booking when this update confirmed it, otherwise null
     */
    @Transactional
    public Booking apply(BookingRef ref, BookingPaymentStatus status, String providerPaymentId) {
        if (ref == null || ref.bookingId() == null || ref.type() == null) {
            return null;
        }
        if (ref.type() == BookingType.CUSTOMER_SPACE) {
            return applyToSpaceBooking(ref.bookingId(), status, providerPaymentId);
        }
        if (ref.type() == BookingType.AIRPORT) {
            int updated = externalBookingJooqRepository.updateAirportPaymentStatus(
                    ref.bookingId(), status.getCode(), providerPaymentId, allowedFromCodes(status));
            log.info("Airport booking payment status: bookingId={}, status={}, rows={}",
                    ref.bookingId(), status.getCode(), updated);
        } else if (ref.type() == BookingType.GARAGE && status == BookingPaymentStatus.PAID) {
            int updated = externalBookingJooqRepository.activateGarageReservation(ref.bookingId());
            log.info("Garage reservation activated: reservationId={}, rows={}", ref.bookingId(), updated);
        }
        return null;
    }

    private Booking applyToSpaceBooking(Long bookingId, BookingPaymentStatus status, String providerPaymentId) {
        Booking booking = bookingRepository.findById(bookingId).orElse(null);
        if (booking == null) {
            log.warn("Payment references unknown booking: bookingId={}", bookingId);
            return null;
        }
        if (providerPaymentId != null && booking.getProviderPaymentId() != null
                && !Objects.equals(booking.getProviderPaymentId(), providerPaymentId)) {
            log.warn("Ignoring payment for superseded intent: bookingId={}, intentId={}, current={}",
                    bookingId, providerPaymentId, booking.getProviderPaymentId());
            return null;
        }
        if (!ALLOWED_FROM.get(status).contains(booking.getPaymentStatus())) {
            log.info("Booking payment status unchanged: bookingId={}, current={}, requested={}",
                    bookingId, booking.getPaymentStatus().getCode(), status.getCode());
            return null;
        }
        boolean confirmed = booking.updatePaymentStatus(status, providerPaymentId);
        log.info("Booking payment status: bookingId={}, status={}, confirmed={}",
                bookingId, status.getCode(), confirmed);
        if (booking.isRefundDue()) {
            log.warn("Payment captured on cancelled booking, refund due: bookingId={}, intentId={}, amount={}",
                    bookingId, booking.getProviderPaymentId(), booking.getTotalPrice());
        }
        return confirmed ? booking : null;
    }

    static List<String> allowedFromCodes(BookingPaymentStatus status) {
        return ALLOWED_FROM.get(status).stream()
                .map(BookingPaymentStatus::getCode)
                .toList();
    }

    public record BookingRef(BookingType type, Long bookingId) {

        public static BookingRef of(Payment payment) {
            return new BookingRef(payment.getBookingType(), payment.getBookingId());
        }
    }
}
