package com.parkalot.parking.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkalot.parking.event.IdempotencyService;
import com.parkalot.parking.event.producer.BookingEventProducer;
import com.parkalot.parking.event.producer.PaymentEventProducer;
import com.parkalot.parking.service.PaymentRecordService;
import com.parkalot.parking.service.PaymentRecordService.SettlementOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies verified payment provider events to local payment and booking state.
 * Redelivered events are skipped by event id; every update is also idempotent on its own,
 * so a replay that slips past the event-id check changes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookReconciler {

    private final WebhookSignatureVerifier signatureVerifier;
    private final IdempotencyService idempotencyService;
    private final PaymentRecordService paymentRecordService;
    private final PaymentEventProducer paymentEventProducer;
    private final BookingEventProducer bookingEventProducer;
    private final ObjectMapper objectMapper;

    public WebhookResult handle(String payload, String signatureHeader) {
        signatureVerifier.verify(payload, signatureHeader);
        return apply(WebhookEvent.parse(objectMapper, payload));
    }

    public WebhookResult apply(WebhookEvent event) {
        if (idempotencyService.isDuplicate(event.id())) {
            log.info("Duplicate webhook skipped: eventId={}, type={}", event.id(), event.type());
            return new WebhookResult(event.type(), true);
        }

        String intentId = event.intentId();
        if (intentId == null) {
            log.info("Webhook without payment intent ignored: eventId={}, type={}", event.id(), event.type());
        } else if (WebhookEvent.PAYMENT_SUCCEEDED.equals(event.type())) {
            onSucceeded(event, intentId);
        } else if (WebhookEvent.PAYMENT_FAILED.equals(event.type())) {
            paymentRecordService.recordFailure(intentId, event.failureMessage())
                    .ifPresent(paymentEventProducer::publishPaymentFailed);
        } else if (WebhookEvent.CHARGE_REFUNDED.equals(event.type())) {
            paymentRecordService.applyProviderRefund(intentId, event.amountRefunded())
                    .ifPresent(paymentEventProducer::publishPaymentRefunded);
        } else {
            log.debug("Unhandled webhook type: eventId={}, type={}", event.id(), event.type());
        }

        idempotencyService.markProcessed(event.id(), event.type());
        return new WebhookResult(event.type(), false);
    }

    private void onSucceeded(WebhookEvent event, String intentId) {
        SettlementOutcome outcome = paymentRecordService.settleSucceeded(intentId, event.bookingRef());
        if (outcome.paymentChanged()) {
            paymentEventProducer.publishPaymentSucceeded(outcome.payment());
        }
        if (outcome.confirmedBooking() != null) {
            bookingEventProducer.publishBookingConfirmed(outcome.confirmedBooking());
        }
    }

    public record WebhookResult(String type, boolean duplicate) {
    }
}
