package com.parkalot.parking.service;

import com.parkalot.parking.TestFixtures;
import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.domain.BookingType;
import com.parkalot.parking.jooq.ExternalBookingJooqRepository;
import com.parkalot.parking.repository.BookingRepository;
import com.parkalot.parking.service.BookingPaymentUpdater.BookingRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingPaymentUpdaterTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 6, 2, 9, 0);

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private ExternalBookingJooqRepository externalBookingJooqRepository;

    @InjectMocks
    private BookingPaymentUpdater updater;

    private Booking spaceBooking(String intentId) {
        Booking booking = TestFixtures.createBooking(1L, 10L, 100L, 200L,
                START, START.plusHours(3), new BigDecimal("15.00"));
        if (intentId != null) {
            booking.attachPaymentIntent(intentId);
        }
        when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));
        return booking;
    }

    @Test
    void apply_paidOnPendingSpaceBooking_confirms() {
        Booking booking = spaceBooking("pi_1");

        Booking confirmed = updater.apply(new BookingRef(BookingType.CUSTOMER_SPACE, 1L),
                BookingPaymentStatus.PAID, "pi_1");

        assertThat(confirmed).isSameAs(booking);
        assertThat(booking.getBookingStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PAID);
    }

    @Test
    void apply_paidTwice_secondReturnsNull() {
        Booking booking = spaceBooking("pi_1");
        BookingRef ref = new BookingRef(BookingType.CUSTOMER_SPACE, 1L);

        updater.apply(ref, BookingPaymentStatus.PAID, "pi_1");
        Booking second = updater.apply(ref, BookingPaymentStatus.PAID, "pi_1");

        assertThat(second).isNull();
        assertThat(booking.getBookingStatus()).isEqualTo(BookingStatus.CONFIRMED);
    }

    @Test
    void apply_supersededIntent_ignored() {
        Booking booking = spaceBooking("pi_new");

        Booking confirmed = updater.apply(new BookingRef(BookingType.CUSTOMER_SPACE, 1L),
                BookingPaymentStatus.PAID, "pi_old");

        assertThat(confirmed).isNull();
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PENDING);
    }

    @Test
    void apply_failedAfterPaid_ignored() {
        Booking booking = spaceBooking("pi_1");
        BookingRef ref = new BookingRef(BookingType.CUSTOMER_SPACE, 1L);
        updater.apply(ref, BookingPaymentStatus.PAID, "pi_1");

        updater.apply(ref, BookingPaymentStatus.FAILED, "pi_1");

        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PAID);
    }

    @Test
    void apply_refundedAfterPaid_keepsBookingStatus() {
        Booking booking = spaceBooking("pi_1");
        BookingRef ref = new BookingRef(BookingType.CUSTOMER_SPACE, 1L);
        updater.apply(ref, BookingPaymentStatus.PAID, "pi_1");

        updater.apply(ref, BookingPaymentStatus.PARTIAL_REFUND, "pi_1");

        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PARTIAL_REFUND);
        assertThat(booking.getBookingStatus()).isEqualTo(BookingStatus.CONFIRMED);
    }

    @Test
    void apply_paidAfterCancellation_flagsRefundDue() {
        Booking booking = spaceBooking("pi_1");
        booking.cancel(100L, "plans changed", START.minusDays(1));

        Booking confirmed = updater.apply(new BookingRef(BookingType.CUSTOMER_SPACE, 1L),
                BookingPaymentStatus.PAID, "pi_1");

        assertThat(confirmed).isNull();
        assertThat(booking.getBookingStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PAID);
        assertThat(booking.isRefundDue()).isTrue();
    }

    @Test
    void allowedFromCodes_paid_onlyFromUnpaidStates() {
        assertThat(BookingPaymentUpdater.allowedFromCodes(BookingPaymentStatus.PAID))
                .containsExactly("pending", "failed");
        assertThat(BookingPaymentUpdater.allowedFromCodes(BookingPaymentStatus.REFUNDED))
                .containsExactly("paid", "partial_refund");
    }

    @Test
    void apply_unknownSpaceBooking_returnsNull() {
        when(bookingRepository.findById(99L)).thenReturn(Optional.empty());

        assertThat(updater.apply(new BookingRef(BookingType.CUSTOMER_SPACE, 99L),
                BookingPaymentStatus.PAID, "pi_1")).isNull();
    }

    @Test
    void apply_airport_updatesExternalBooking() {
        updater.apply(new BookingRef(BookingType.AIRPORT, 5L), BookingPaymentStatus.PAID, "pi_a");

        verify(externalBookingJooqRepository).updateAirportPaymentStatus(5L, "paid", "pi_a", List.of("pending", "failed"));
        verifyNoInteractions(bookingRepository);
    }

    @Test
    void apply_garagePaid_activatesReservation() {
        updater.apply(new BookingRef(BookingType.GARAGE, 7L), BookingPaymentStatus.PAID, "pi_g");

        verify(externalBookingJooqRepository).activateGarageReservation(7L);
    }

    @Test
    void apply_garageFailed_leavesReservation() {
        updater.apply(new BookingRef(BookingType.GARAGE, 7L), BookingPaymentStatus.FAILED, "pi_g");

        verifyNoInteractions(externalBookingJooqRepository);
    }

    @Test
    void apply_missingReference_noOp() {
        assertThat(updater.apply(null, BookingPaymentStatus.PAID, "pi_1")).isNull();
        assertThat(updater.apply(new BookingRef(BookingType.CUSTOMER_SPACE, null),
                BookingPaymentStatus.PAID, "pi_1")).isNull();

        verifyNoInteractions(bookingRepository, externalBookingJooqRepository);
    }
}
