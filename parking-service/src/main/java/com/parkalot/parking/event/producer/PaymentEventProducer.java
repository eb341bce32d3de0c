package com.parkalot.parking.event.producer;

import com.parkalot.common.event.PaymentEvent;
import com.parkalot.common.event.Topics;
import com.parkalot.parking.domain.Payment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PaymentEventProducer {

    private final ResilientKafkaPublisher publisher;

    public void publishPaymentSucceeded(Payment payment) {
        PaymentEvent event = PaymentEvent.succeeded(payment.getId(), payment.getBookingType().getCode(),
                payment.getBookingId(), payment.getUserId(), payment.getAmount());
        publisher.publish(Topics.PAYMENT_SUCCEEDED, key(payment), event, "payment-succeeded");
    }

    public void publishPaymentFailed(Payment payment) {
        PaymentEvent event = PaymentEvent.failed(payment.getId(), payment.getBookingType().getCode(),
                payment.getBookingId(), payment.getUserId(), payment.getAmount());
        publisher.publish(Topics.PAYMENT_FAILED, key(payment), event, "payment-failed");
    }

    public void publishPaymentRefunded(Payment payment) {
        PaymentEvent event = PaymentEvent.refunded(payment.getId(), payment.getBookingType().getCode(),
                payment.getBookingId(), payment.getUserId(), payment.getRefundAmount());
        publisher.publish(Topics.PAYMENT_REFUNDED, key(payment), event, "payment-refunded");
    }

    private String key(Payment payment) {
        return String.valueOf(payment.getId());
    }
}
