package com.parkalot.parking.service;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.TestFixtures;
import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.domain.Space;
import com.parkalot.parking.domain.SpaceStatus;
import com.parkalot.parking.dto.request.CreateBookingRequest;
import com.parkalot.parking.dto.response.BookedSlotResponse;
import com.parkalot.parking.dto.response.CancellationResponse;
import com.parkalot.parking.event.producer.BookingEventProducer;
import com.parkalot.parking.jooq.BookingJooqRepository;
import com.parkalot.parking.repository.BookingRepository;
import com.parkalot.parking.repository.SpaceRepository;
import com.parkalot.parking.service.BookingTransactionService.CancellationOutcome;
import com.parkalot.parking.service.BookingTransactionService.PaymentStatusOutcome;
import com.parkalot.parking.service.PaymentGateway.RefundResult;
import com.parkalot.parking.service.PricingEngine.PriceQuote;
import com.parkalot.parking.service.PricingEngine.RefundDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    private static final Long SPACE_ID = 10L;
    private static final Long RENTER_ID = 100L;
    private static final Long OWNER_ID = 200L;
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 9, 0);

    @Mock
    private BookingTransactionService transactionService;
    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private SpaceRepository spaceRepository;
    @Mock
    private BookingJooqRepository bookingJooqRepository;
    @Mock
    private AvailabilityChecker availabilityChecker;
    @Mock
    private SpaceLockService spaceLockService;
    @Mock
    private PaymentService paymentService;
    @Mock
    private BookingEventProducer bookingEventProducer;

    private BookingService bookingService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        bookingService = new BookingService(transactionService, bookingRepository, spaceRepository,
                bookingJooqRepository, availabilityChecker, new PricingEngine(), spaceLockService,
                paymentService, bookingEventProducer, clock);
    }

    private static CreateBookingRequest request(LocalDateTime start, LocalDateTime end) {
        return new CreateBookingRequest(SPACE_ID, start, end, null, null, null, null, null);
    }

    private static Booking booking(LocalDateTime start) {
        return TestFixtures.createBooking(1L, SPACE_ID, RENTER_ID, OWNER_ID,
                start, start.plusHours(4), new BigDecimal("40.00"));
    }

    @Test
    void createBooking_success_locksCreatesReleasesAndPublishes() {
        CreateBookingRequest request = request(NOW.plusDays(1), NOW.plusDays(1).plusHours(3));
        Optional<RLock> lock = Optional.of(mock(RLock.class));
        Booking created = booking(NOW.plusDays(1));
        when(spaceLockService.acquire(SPACE_ID)).thenReturn(lock);
        when(transactionService.createInTransaction(RENTER_ID, request)).thenReturn(created);

        Booking result = bookingService.createBooking(RENTER_ID, request);

        assertThat(result).isSameAs(created);
        verify(spaceLockService).release(lock);
        verify(bookingEventProducer).publishBookingCreated(created);
    }

    @Test
    void createBooking_transactionFails_releasesLockWithoutPublishing() {
        CreateBookingRequest request = request(NOW.plusDays(1), NOW.plusDays(1).plusHours(3));
        Optional<RLock> lock = Optional.empty();
        when(spaceLockService.acquire(SPACE_ID)).thenReturn(lock);
        when(transactionService.createInTransaction(RENTER_ID, request))
                .thenThrow(new BusinessException(ErrorCode.SPACE_UNAVAILABLE));

        assertThatThrownBy(() -> bookingService.createBooking(RENTER_ID, request))
                .isInstanceOf(BusinessException.class);

        verify(spaceLockService).release(lock);
        verify(bookingEventProducer, never()).publishBookingCreated(any());
    }

    @Test
    void createBooking_endBeforeStart_rejectedBeforeLocking() {
        CreateBookingRequest request = request(NOW.plusDays(1), NOW.plusDays(1).minusHours(1));

        assertThatThrownBy(() -> bookingService.createBooking(RENTER_ID, request))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_TIME_RANGE);
        verifyNoInteractions(spaceLockService, transactionService);
    }

    @Test
    void createBooking_startInPast_throws() {
        CreateBookingRequest request = request(NOW.minusHours(1), NOW.plusHours(2));

        assertThatThrownBy(() -> bookingService.createBooking(RENTER_ID, request))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.START_TIME_IN_PAST);
        verifyNoInteractions(spaceLockService);
    }

    @Test
    void calculatePrice_matchesBookingTotal() {
        Space space = TestFixtures.createSpace(SPACE_ID, OWNER_ID, SpaceStatus.ACTIVE, new BigDecimal("5.00"), null);
        when(spaceRepository.findById(SPACE_ID)).thenReturn(Optional.of(space));

        PriceQuote quote = bookingService.calculatePrice(SPACE_ID, NOW, NOW.plusHours(3));

        assertThat(quote.subtotal()).isEqualByComparingTo("15.00");
        assertThat(quote.serviceFee()).isEqualByComparingTo("2.25");
        assertThat(quote.quotedRenterTotal()).isEqualByComparingTo("17.25");
    }

    @Test
    void calculatePrice_unknownSpace_throwsNotFound() {
        when(spaceRepository.findById(SPACE_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookingService.calculatePrice(SPACE_ID, NOW, NOW.plusHours(3)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.SPACE_NOT_FOUND);
    }

    @Test
    void isAvailable_delegatesToChecker() {
        when(availabilityChecker.isAvailable(SPACE_ID, NOW, NOW.plusHours(2))).thenReturn(false);

        assertThat(bookingService.isAvailable(SPACE_ID, NOW, NOW.plusHours(2))).isFalse();
    }

    @Test
    void updateStatus_confirmed_publishesConfirmed() {
        Booking confirmed = booking(NOW.plusDays(1));
        when(transactionService.updateStatusInTransaction(1L, BookingStatus.CONFIRMED, OWNER_ID, null))
                .thenReturn(confirmed);

        bookingService.updateStatus(1L, BookingStatus.CONFIRMED, OWNER_ID, null);

        verify(bookingEventProducer).publishBookingConfirmed(confirmed);
    }

    @Test
    void updateStatus_completed_publishesCompleted() {
        Booking completed = booking(NOW.minusHours(4));
        when(transactionService.updateStatusInTransaction(1L, BookingStatus.COMPLETED, RENTER_ID, null))
                .thenReturn(completed);

        bookingService.updateStatus(1L, BookingStatus.COMPLETED, RENTER_ID, null);

        verify(bookingEventProducer).publishBookingCompleted(completed);
    }

    @Test
    void updateStatus_cancelled_routesThroughCancellation() {
        Booking booking = booking(NOW.plusDays(2));
        when(transactionService.cancelInTransaction(1L, RENTER_ID, "No longer needed"))
                .thenReturn(new CancellationOutcome(booking, RefundDecision.none()));
        when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));

        bookingService.updateStatus(1L, BookingStatus.CANCELLED, RENTER_ID, "No longer needed");

        verify(transactionService, never()).updateStatusInTransaction(any(), any(), any(), any());
        verify(bookingEventProducer).publishBookingCancelled(eq(booking), any());
    }

    @Test
    void cancelBooking_paidAndEligible_issuesRefund() {
        Booking booking = booking(NOW.plusDays(2));
        booking.updatePaymentStatus(BookingPaymentStatus.PAID, "pi_1");
        RefundDecision refund = new RefundDecision(new BigDecimal("40.00"), true);
        when(transactionService.cancelInTransaction(1L, RENTER_ID, null))
                .thenReturn(new CancellationOutcome(booking, refund));
        when(paymentService.refundBookingPayment(booking, new BigDecimal("40.00")))
                .thenReturn(RefundResult.success("re_1", new BigDecimal("40.00"), "succeeded"));

        CancellationResponse response = bookingService.cancelBooking(1L, RENTER_ID, null);

        assertThat(response.refundEligible()).isTrue();
        assertThat(response.refundIssued()).isTrue();
        assertThat(response.refundId()).isEqualTo("re_1");
        verify(bookingEventProducer).publishBookingCancelled(booking, new BigDecimal("40.00"));
    }

    @Test
    void cancelBooking_refundFails_stillCancelled() {
        Booking booking = booking(NOW.plusDays(2));
        booking.updatePaymentStatus(BookingPaymentStatus.PAID, "pi_1");
        RefundDecision refund = new RefundDecision(new BigDecimal("40.00"), true);
        when(transactionService.cancelInTransaction(1L, RENTER_ID, null))
                .thenReturn(new CancellationOutcome(booking, refund));
        when(paymentService.refundBookingPayment(any(), any()))
                .thenReturn(RefundResult.failure("card_expired"));

        CancellationResponse response = bookingService.cancelBooking(1L, RENTER_ID, null);

        assertThat(response.refundEligible()).isTrue();
        assertThat(response.refundIssued()).isFalse();
        assertThat(response.refundId()).isNull();
        verify(bookingEventProducer).publishBookingCancelled(any(), any());
    }

    @Test
    void cancelBooking_notEligible_skipsRefund() {
        Booking booking = booking(NOW.plusHours(2));
        when(transactionService.cancelInTransaction(1L, OWNER_ID, null))
                .thenReturn(new CancellationOutcome(booking, RefundDecision.none()));

        CancellationResponse response = bookingService.cancelBooking(1L, OWNER_ID, null);

        assertThat(response.refundIssued()).isFalse();
        verifyNoInteractions(paymentService);
    }

    @Test
    void updatePaymentStatus_confirmed_publishesConfirmed() {
        Booking booking = booking(NOW.plusDays(1));
        when(transactionService.updatePaymentStatus(1L, BookingPaymentStatus.PAID, "pi_1"))
                .thenReturn(new PaymentStatusOutcome(booking, true));

        bookingService.updatePaymentStatus(1L, BookingPaymentStatus.PAID, "pi_1");

        verify(bookingEventProducer).publishBookingConfirmed(booking);
    }

    @Test
    void updatePaymentStatus_notConfirmed_noEvent() {
        Booking booking = booking(NOW.plusDays(1));
        when(transactionService.updatePaymentStatus(1L, BookingPaymentStatus.FAILED, null))
                .thenReturn(new PaymentStatusOutcome(booking, false));

        bookingService.updatePaymentStatus(1L, BookingPaymentStatus.FAILED, null);

        verifyNoInteractions(bookingEventProducer);
    }

    @Test
    void getBooking_stranger_throwsAccessDenied() {
        when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking(NOW.plusDays(1))));

        assertThatThrownBy(() -> bookingService.getBooking(1L, 999L))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.ACCESS_DENIED);
    }

    @Test
    void getRenterBookings_withStatus_usesFilteredQuery() {
        when(bookingRepository.findByRenterIdAndBookingStatusOrderByStartTimeDesc(RENTER_ID, BookingStatus.CONFIRMED))
                .thenReturn(List.of());

        assertThat(bookingService.getRenterBookings(RENTER_ID, BookingStatus.CONFIRMED)).isEmpty();
        verify(bookingRepository, never()).findByRenterIdOrderByStartTimeDesc(any());
    }

    @Test
    void getSpaceCalendar_defaultsFromToNow() {
        Booking booking = booking(NOW.plusDays(1));
        when(spaceRepository.existsById(SPACE_ID)).thenReturn(true);
        when(bookingRepository.findSpaceCalendar(SPACE_ID, BookingStatus.OCCUPYING, NOW)).thenReturn(List.of(booking));

        List<BookedSlotResponse> slots = bookingService.getSpaceCalendar(SPACE_ID, null);

        assertThat(slots).hasSize(1);
        assertThat(slots.get(0).startTime()).isEqualTo(NOW.plusDays(1));
    }

    @Test
    void getSpaceCalendar_unknownSpace_throws() {
        when(spaceRepository.existsById(SPACE_ID)).thenReturn(false);

        assertThatThrownBy(() -> bookingService.getSpaceCalendar(SPACE_ID, null))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.SPACE_NOT_FOUND);
    }

    @Test
    void getUpcomingCount_usesClockNow() {
        when(bookingJooqRepository.countUpcoming(OWNER_ID, true, NOW)).thenReturn(3L);

        assertThat(bookingService.getUpcomingCount(OWNER_ID, true)).isEqualTo(3);
    }
}
