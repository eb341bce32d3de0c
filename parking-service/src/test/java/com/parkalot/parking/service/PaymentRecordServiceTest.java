package com.parkalot.parking.service;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.TestFixtures;
import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.BookingType;
import com.parkalot.parking.domain.Payment;
import com.parkalot.parking.domain.PaymentStatus;
import com.parkalot.parking.repository.BookingRepository;
import com.parkalot.parking.repository.PaymentRepository;
import com.parkalot.parking.service.BookingPaymentUpdater.BookingRef;
import com.parkalot.parking.service.PaymentRecordService.SettlementOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentRecordServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 9, 0);

    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingPaymentUpdater bookingPaymentUpdater;

    private PaymentRecordService recordService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        recordService = new PaymentRecordService(paymentRepository, bookingRepository, bookingPaymentUpdater, clock);
    }

    private Payment payment(String intentId) {
        Payment payment = TestFixtures.createPayment(1L, 100L, BookingType.CUSTOMER_SPACE, 5L,
                new BigDecimal("40.00"), intentId);
        when(paymentRepository.findByProviderPaymentId(intentId)).thenReturn(Optional.of(payment));
        return payment;
    }

    @Test
    void recordSpacePayment_attachesIntentToBooking() {
        Booking booking = TestFixtures.createBooking(5L, 10L, 100L, 200L,
                NOW.plusDays(1), NOW.plusDays(1).plusHours(8), new BigDecimal("40.00"));
        Payment payment = TestFixtures.createPayment(null, 100L, BookingType.CUSTOMER_SPACE, 5L,
                new BigDecimal("40.00"), "pi_new");
        when(bookingRepository.findById(5L)).thenReturn(Optional.of(booking));
        when(paymentRepository.save(payment)).thenReturn(payment);

        recordService.recordSpacePayment(payment, 5L);

        assertThat(booking.getProviderPaymentId()).isEqualTo("pi_new");
        verify(paymentRepository).save(payment);
    }

    @Test
    void settleSucceeded_pendingPayment_marksSucceededAndUpdatesBooking() {
        Payment payment = payment("pi_1");
        Booking confirmed = mock(Booking.class);
        when(bookingPaymentUpdater.apply(new BookingRef(BookingType.CUSTOMER_SPACE, 5L),
                BookingPaymentStatus.PAID, "pi_1")).thenReturn(confirmed);

        SettlementOutcome outcome = recordService.settleSucceeded("pi_1", null);

        assertThat(outcome.paymentChanged()).isTrue();
        assertThat(outcome.confirmedBooking()).isSameAs(confirmed);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.SUCCEEDED);
    }

    @Test
    void settleSucceeded_alreadySucceeded_reportsNoChange() {
        Payment payment = payment("pi_1");
        payment.markSucceeded();

        SettlementOutcome outcome = recordService.settleSucceeded("pi_1", null);

        assertThat(outcome.paymentChanged()).isFalse();
        assertThat(outcome.confirmedBooking()).isNull();
    }

    @Test
    void settleSucceeded_explicitRef_overridesPaymentBooking() {
        payment("pi_1");
        BookingRef ref = new BookingRef(BookingType.AIRPORT, 77L);

        recordService.settleSucceeded("pi_1", ref);

        verify(bookingPaymentUpdater).apply(ref, BookingPaymentStatus.PAID, "pi_1");
    }

    @Test
    void settleSucceeded_unknownIntent_stillUpdatesReferencedBooking() {
        when(paymentRepository.findByProviderPaymentId("pi_x")).thenReturn(Optional.empty());
        BookingRef ref = new BookingRef(BookingType.GARAGE, 3L);

        SettlementOutcome outcome = recordService.settleSucceeded("pi_x", ref);

        assertThat(outcome.payment()).isNull();
        assertThat(outcome.paymentChanged()).isFalse();
        verify(bookingPaymentUpdater).apply(ref, BookingPaymentStatus.PAID, "pi_x");
    }

    @Test
    void recordFailure_pending_marksFailedAndUpdatesBooking() {
        Payment payment = payment("pi_1");

        Optional<Payment> failed = recordService.recordFailure("pi_1", "card_declined");

        assertThat(failed).containsSame(payment);
        assertThat(payment.getFailureReason()).isEqualTo("card_declined");
        verify(bookingPaymentUpdater).apply(any(), eq(BookingPaymentStatus.FAILED), eq("pi_1"));
    }

    @Test
    void recordFailure_alreadySucceeded_ignored() {
        payment("pi_1").markSucceeded();

        assertThat(recordService.recordFailure("pi_1", "late")).isEmpty();
        verifyNoInteractions(bookingPaymentUpdater);
    }

    @Test
    void recordRefund_partial_setsPartialRefundOnBooking() {
        Payment payment = TestFixtures.createPayment(1L, 100L, BookingType.CUSTOMER_SPACE, 5L,
                new BigDecimal("40.00"), "pi_1");
        payment.markSucceeded();
        when(paymentRepository.findById(1L)).thenReturn(Optional.of(payment));

        recordService.recordRefund(1L, new BigDecimal("20.00"));

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PARTIAL_REFUND);
        assertThat(payment.getRefundedAt()).isEqualTo(NOW);
        verify(bookingPaymentUpdater).apply(any(), eq(BookingPaymentStatus.PARTIAL_REFUND), eq("pi_1"));
    }

    @Test
    void recordRefund_full_setsRefundedOnBooking() {
        Payment payment = TestFixtures.createPayment(1L, 100L, BookingType.CUSTOMER_SPACE, 5L,
                new BigDecimal("40.00"), "pi_1");
        payment.markSucceeded();
        when(paymentRepository.findById(1L)).thenReturn(Optional.of(payment));

        recordService.recordRefund(1L, new BigDecimal("40.00"));

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        verify(bookingPaymentUpdater).apply(any(), eq(BookingPaymentStatus.REFUNDED), eq("pi_1"));
    }

    @Test
    void recordRefund_pendingPayment_throwsNotRefundable() {
        Payment payment = TestFixtures.createPayment(1L, 100L, BookingType.CUSTOMER_SPACE, 5L,
                new BigDecimal("40.00"), "pi_1");
        when(paymentRepository.findById(1L)).thenReturn(Optional.of(payment));

        assertThatThrownBy(() -> recordService.recordRefund(1L, BigDecimal.TEN))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.PAYMENT_NOT_REFUNDABLE);
    }

    @Test
    void applyProviderRefund_updatesPaymentOnly() {
        Payment payment = payment("pi_1");
        payment.markSucceeded();

        Optional<Payment> result = recordService.applyProviderRefund("pi_1", new BigDecimal("40.00"));

        assertThat(result).containsSame(payment);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        verifyNoInteractions(bookingPaymentUpdater);
    }

    @Test
    void applyProviderRefund_repeated_returnsEmpty() {
        Payment payment = payment("pi_1");
        payment.markSucceeded();
        recordService.applyProviderRefund("pi_1", new BigDecimal("40.00"));

        assertThat(recordService.applyProviderRefund("pi_1", new BigDecimal("40.00"))).isEmpty();
    }
}
