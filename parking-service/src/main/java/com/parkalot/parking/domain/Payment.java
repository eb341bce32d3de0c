package com.parkalot.parking.domain;

import com.parkalot.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Payment extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "payment_id")
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Convert(converter = BookingType.DbConverter.class)
    @Column(nullable = false, length = 20)
    private BookingType bookingType;

    private Long bookingId;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "stripe_payment_intent_id", unique = true)
    private String providerPaymentId;

    @Column(name = "stripe_customer_id")
    private String providerCustomerId;

    private String description;

    @Convert(converter = PaymentStatus.DbConverter.class)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(length = 255)
    private String failureReason;

    @Column(precision = 10, scale = 2)
    private BigDecimal refundAmount;

    private LocalDateTime refundedAt;

    @Convert(converter = MetadataConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> metadata = new HashMap<>();

    @Builder
    private Payment(Long userId, BookingType bookingType, Long bookingId, BigDecimal amount,
                    String currency, String providerPaymentId, String providerCustomerId,
                    String description, Map<String, String> metadata) {
        this.userId = userId;
        this.bookingType = bookingType;
        this.bookingId = bookingId;
        this.amount = amount;
        this.currency = currency;
        this.providerPaymentId = providerPaymentId;
        this.providerCustomerId = providerCustomerId;
        this.description = description;
        this.status = PaymentStatus.PENDING;
        if (metadata != null) {
            this.metadata = new HashMap<>(metadata);
        }
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    /**
     * @return false when the payment had already settled as succeeded or been refunded
     */
    public boolean markSucceeded() {
        if (status != PaymentStatus.PENDING && status != PaymentStatus.FAILED) {
            return false;
        }
        this.status = PaymentStatus.SUCCEEDED;
        this.failureReason = null;
        return true;
    }

    /**
     * A failure notification only applies while the payment is still open.
     */
    public boolean markFailed(String reason) {
        if (status != PaymentStatus.PENDING) {
            return false;
        }
        this.status = PaymentStatus.FAILED;
        this.failureReason = reason;
        return true;
    }

    public BigDecimal refundableAmount() {
        BigDecimal refunded = refundAmount != null ? refundAmount : BigDecimal.ZERO;
        return amount.subtract(refunded);
    }

    public boolean isRefundable() {
        return status == PaymentStatus.SUCCEEDED || status == PaymentStatus.PARTIAL_REFUND;
    }

    /**
     * Adds a refund issued through this service.
     *
     * @return the resulting status, refunded once nothing is left to refund
     */
    public PaymentStatus recordRefund(BigDecimal refunded, LocalDateTime now) {
        if (!isRefundable()) {
            throw new IllegalStateException("Cannot refund payment: current status=" + status.getCode());
        }
        BigDecimal total = (refundAmount != null ? refundAmount : BigDecimal.ZERO).add(refunded);
        this.refundAmount = total.min(amount);
        this.refundedAt = now;
        this.status = refundAmount.compareTo(amount) >= 0 ? PaymentStatus.REFUNDED : PaymentStatus.PARTIAL_REFUND;
        return status;
    }

    /**
     * Applies the provider's view of the total refunded amount. Repeated
     * notifications with the same amount leave the payment unchanged.
     *
     * @param totalRefunded cumulative amount refunded, or null when the provider did not report it
     * @return false when nothing changed
     */
    public boolean applyProviderRefund(BigDecimal totalRefunded, LocalDateTime now) {
        if (status == PaymentStatus.PENDING || status == PaymentStatus.FAILED) {
            return false;
        }
        BigDecimal refunded = totalRefunded != null ? totalRefunded.min(amount) : amount;
        PaymentStatus target = refunded.compareTo(amount) >= 0 ? PaymentStatus.REFUNDED : PaymentStatus.PARTIAL_REFUND;
        if (target == status && refundAmount != null && refundAmount.compareTo(refunded) == 0) {
            return false;
        }
        this.refundAmount = refunded;
        this.status = target;
        if (refundedAt == null) {
            this.refundedAt = now;
        }
        return true;
    }
}
