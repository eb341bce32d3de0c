package com.parkalot.parking.event.producer;

import com.parkalot.common.event.PaymentEvent;
import com.parkalot.common.event.Topics;
import com.parkalot.parking.TestFixtures;
import com.parkalot.parking.domain.BookingType;
import com.parkalot.parking.domain.Payment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PaymentEventProducerTest {

    @Mock
    private ResilientKafkaPublisher publisher;

    @InjectMocks
    private PaymentEventProducer paymentEventProducer;

    private static Payment payment() {
        return TestFixtures.createPayment(7L, 100L, BookingType.CUSTOMER_SPACE, 5L, new BigDecimal("40.00"), "pi_1");
    }

    private PaymentEvent captured(String topic, String eventName) {
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publish(eq(topic), eq("7"), event.capture(), eq(eventName));
        return (PaymentEvent) event.getValue();
    }

    @Test
    void publishPaymentSucceeded_keyedByPayment() {
        paymentEventProducer.publishPaymentSucceeded(payment());

        PaymentEvent event = captured(Topics.PAYMENT_SUCCEEDED, "payment-succeeded");
        assertThat(event.getEventType()).isEqualTo(PaymentEvent.TYPE_SUCCEEDED);
        assertThat(event.getBookingType()).isEqualTo("customer_space");
        assertThat(event.getAmount()).isEqualByComparingTo("40.00");
    }

    @Test
    void publishPaymentFailed_publishesToFailedTopic() {
        paymentEventProducer.publishPaymentFailed(payment());

        PaymentEvent event = captured(Topics.PAYMENT_FAILED, "payment-failed");
        assertThat(event.getBookingId()).isEqualTo(5L);
    }

    @Test
    void publishPaymentRefunded_carriesRefundedAmount() {
        Payment payment = payment();
        payment.markSucceeded();
        payment.recordRefund(new BigDecimal("12.50"), LocalDateTime.of(2025, 6, 1, 9, 0));

        paymentEventProducer.publishPaymentRefunded(payment);

        PaymentEvent event = captured(Topics.PAYMENT_REFUNDED, "payment-refunded");
        assertThat(event.getAmount()).isEqualByComparingTo("12.50");
    }
}
