package com.parkalot.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentEvent extends DomainEvent {

    public static final String AGGREGATE_TYPE = "payment";

    public static final String TYPE_SUCCEEDED = "PAYMENT_SUCCEEDED";
    public static final String TYPE_FAILED = "PAYMENT_FAILED";
    public static final String TYPE_REFUNDED = "PAYMENT_REFUNDED";

    private Long paymentId;
    private String bookingType;
    private Long bookingId;
    private Long userId;
    private BigDecimal amount;

    private PaymentEvent(String eventType, Long paymentId, String bookingType, Long bookingId,
                         Long userId, BigDecimal amount) {
        super(eventType, AGGREGATE_TYPE, paymentId);
        this.paymentId = paymentId;
        this.bookingType = bookingType;
        this.bookingId = bookingId;
        this.userId = userId;
        this.amount = amount;
    }

    public static PaymentEvent succeeded(Long paymentId, String bookingType, Long bookingId,
                                         Long userId, BigDecimal amount) {
        return new PaymentEvent(TYPE_SUCCEEDED, paymentId, bookingType, bookingId, userId, amount);
    }

    public static PaymentEvent failed(Long paymentId, String bookingType, Long bookingId,
                                      Long userId, BigDecimal amount) {
        return new PaymentEvent(TYPE_FAILED, paymentId, bookingType, bookingId, userId, amount);
    }

    public static PaymentEvent refunded(Long paymentId, String bookingType, Long bookingId,
                                        Long userId, BigDecimal refundAmount) {
        return new PaymentEvent(TYPE_REFUNDED, paymentId, bookingType, bookingId, userId, refundAmount);
    }
}
