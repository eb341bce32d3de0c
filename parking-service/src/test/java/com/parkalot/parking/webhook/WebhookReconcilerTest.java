package com.parkalot.parking.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkalot.parking.TestFixtures;
import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingType;
import com.parkalot.parking.domain.Payment;
import com.parkalot.parking.event.IdempotencyService;
import com.parkalot.parking.event.producer.BookingEventProducer;
import com.parkalot.parking.event.producer.PaymentEventProducer;
import com.parkalot.parking.service.BookingPaymentUpdater.BookingRef;
import com.parkalot.parking.service.PaymentRecordService;
import com.parkalot.parking.service.PaymentRecordService.SettlementOutcome;
import com.parkalot.parking.webhook.WebhookReconciler.WebhookResult;
import com.parkalot.parking.webhook.WebhookSignatureException.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookReconcilerTest {

    private static final String SUCCEEDED_PAYLOAD = """
            {"id":"evt_1","type":"payment_intent.succeeded",
             "data":{"object":{"id":"pi_1","metadata":{"booking_type":"customer_space","booking_id":"5"}}}}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private WebhookSignatureVerifier signatureVerifier;
    @Mock
    private IdempotencyService idempotencyService;
    @Mock
    private PaymentRecordService paymentRecordService;
    @Mock
    private PaymentEventProducer paymentEventProducer;
    @Mock
    private BookingEventProducer bookingEventProducer;

    private WebhookReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new WebhookReconciler(signatureVerifier, idempotencyService, paymentRecordService,
                paymentEventProducer, bookingEventProducer, objectMapper);
    }

    private static Payment payment() {
        return TestFixtures.createPayment(1L, 100L, BookingType.CUSTOMER_SPACE, 5L, new BigDecimal("40.00"), "pi_1");
    }

    private WebhookEvent event(String json) {
        return WebhookEvent.parse(objectMapper, json);
    }

    @Test
    void handle_succeeded_settlesAndPublishes() {
        Payment payment = payment();
        Booking booking = mock(Booking.class);
        when(idempotencyService.isDuplicate("evt_1")).thenReturn(false);
        when(paymentRecordService.settleSucceeded("pi_1", new BookingRef(BookingType.CUSTOMER_SPACE, 5L)))
                .thenReturn(new SettlementOutcome(payment, true, booking));

        WebhookResult result = reconciler.handle(SUCCEEDED_PAYLOAD, "t=1,v1=sig");

        assertThat(result.duplicate()).isFalse();
        assertThat(result.type()).isEqualTo("payment_intent.succeeded");
        verify(signatureVerifier).verify(SUCCEEDED_PAYLOAD, "t=1,v1=sig");
        verify(paymentEventProducer).publishPaymentSucceeded(payment);
        verify(bookingEventProducer).publishBookingConfirmed(booking);
        verify(idempotencyService).markProcessed("evt_1", "payment_intent.succeeded");
    }

    @Test
    void handle_invalidSignature_appliesNothing() {
        doThrow(new WebhookSignatureException(Reason.INVALID_SIGNATURE))
                .when(signatureVerifier).verify(any(), any());

        assertThatThrownBy(() -> reconciler.handle(SUCCEEDED_PAYLOAD, "t=1,v1=bad"))
                .isInstanceOf(WebhookSignatureException.class);
        verifyNoInteractions(idempotencyService, paymentRecordService, paymentEventProducer);
    }

    @Test
    void apply_duplicateEvent_skipped() {
        when(idempotencyService.isDuplicate("evt_1")).thenReturn(true);

        WebhookResult result = reconciler.apply(event(SUCCEEDED_PAYLOAD));

        assertThat(result.duplicate()).isTrue();
        verifyNoInteractions(paymentRecordService, paymentEventProducer, bookingEventProducer);
        verify(idempotencyService, never()).markProcessed(any(), any());
    }

    @Test
    void apply_replayPastIdempotencyCheck_publishesNothingTwice() {
        Payment payment = payment();
        when(idempotencyService.isDuplicate("evt_1")).thenReturn(false);
        when(paymentRecordService.settleSucceeded(any(), any()))
                .thenReturn(new SettlementOutcome(payment, false, null));

        reconciler.apply(event(SUCCEEDED_PAYLOAD));

        verifyNoInteractions(paymentEventProducer, bookingEventProducer);
    }

    @Test
    void apply_paymentFailed_recordsFailure() {
        Payment payment = payment();
        when(idempotencyService.isDuplicate("evt_2")).thenReturn(false);
        when(paymentRecordService.recordFailure("pi_1", "Card declined")).thenReturn(Optional.of(payment));

        reconciler.apply(event("""
                {"id":"evt_2","type":"payment_intent.payment_failed",
                 "data":{"object":{"id":"pi_1","last_payment_error":{"message":"Card declined"}}}}
                """));

        verify(paymentEventProducer).publishPaymentFailed(payment);
        verify(idempotencyService).markProcessed("evt_2", "payment_intent.payment_failed");
    }

    @Test
    void apply_chargeRefunded_appliesProviderRefund() {
        Payment payment = payment();
        when(idempotencyService.isDuplicate("evt_3")).thenReturn(false);
        when(paymentRecordService.applyProviderRefund("pi_1", new BigDecimal("40.00"))).thenReturn(Optional.of(payment));

        reconciler.apply(event("""
                {"id":"evt_3","type":"charge.refunded",
                 "data":{"object":{"id":"ch_1","payment_intent":"pi_1","amount_refunded":4000}}}
                """));

        verify(paymentEventProducer).publishPaymentRefunded(payment);
        verifyNoInteractions(bookingEventProducer);
    }

    @Test
    void apply_unknownType_marksProcessedOnly() {
        when(idempotencyService.isDuplicate("evt_4")).thenReturn(false);

        WebhookResult result = reconciler.apply(event("""
                {"id":"evt_4","type":"customer.created","data":{"object":{"id":"cus_1"}}}
                """));

        assertThat(result.duplicate()).isFalse();
        verifyNoInteractions(paymentRecordService, paymentEventProducer);
        verify(idempotencyService).markProcessed("evt_4", "customer.created");
    }

    @Test
    void apply_missingIntent_ignored() {
        when(idempotencyService.isDuplicate("evt_5")).thenReturn(false);

        reconciler.apply(event("""
                {"id":"evt_5","type":"charge.refunded","data":{"object":{"id":"ch_1"}}}
                """));

        verifyNoInteractions(paymentRecordService);
        verify(idempotencyService).markProcessed("evt_5", "charge.refunded");
    }
}
