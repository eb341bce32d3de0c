package com.parkalot.parking.domain;

import com.parkalot.common.domain.BaseTimeEntity;
import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A renter's reservation of a customer space. All timestamps are UTC.
 * Price, platform fee and owner payout are fixed at creation.
 */
@Entity
@Table(name = "customer_space_bookings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "booking_id")
    private Long id;

    @Column(nullable = false)
    private Long spaceId;

    @Column(nullable = false)
    private Long renterId;

    @Column(nullable = false)
    private Long ownerId;

    @Column(nullable = false)
    private LocalDateTime startTime;

    @Column(nullable = false)
    private LocalDateTime endTime;

    @Embedded
    private VehicleInfo vehicle;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal totalPrice;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal platformFee;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal ownerPayout;

    @Convert(converter = BookingStatus.DbConverter.class)
    @Column(nullable = false, length = 20)
    private BookingStatus bookingStatus;

    @Convert(converter = BookingPaymentStatus.DbConverter.class)
    @Column(nullable = false, length = 20)
    private BookingPaymentStatus paymentStatus;

    @Column(name = "stripe_payment_intent_id")
    private String providerPaymentId;

    @Convert(converter = CancelledBy.DbConverter.class)
    @Column(length = 10)
    private CancelledBy cancelledBy;

    @Column(length = 500)
    private String cancellationReason;

    private LocalDateTime cancelledAt;

    private LocalDateTime checkInTime;

    private LocalDateTime checkOutTime;

    @Column(columnDefinition = "TEXT")
    private String renterNotes;

    @Version
    private Long version;

    @Builder
    private Booking(Long spaceId, Long renterId, Long ownerId,
                    LocalDateTime startTime, LocalDateTime endTime, VehicleInfo vehicle,
                    BigDecimal totalPrice, BigDecimal platformFee, BigDecimal ownerPayout,
                    String renterNotes) {
        this.spaceId = spaceId;
        this.renterId = renterId;
        this.ownerId = ownerId;
        this.startTime = startTime;
        this.endTime = endTime;
        this.vehicle = vehicle;
        this.totalPrice = totalPrice;
        this.platformFee = platformFee;
        this.ownerPayout = ownerPayout;
        this.renterNotes = renterNotes;
        this.bookingStatus = BookingStatus.PENDING;
        this.paymentStatus = BookingPaymentStatus.PENDING;
    }

    public boolean isParticipant(Long userId) {
        return Objects.equals(renterId, userId) || Objects.equals(ownerId, userId);
    }

    /**
     * Money was captured for a booking that no longer takes place.
     */
    public boolean isRefundDue() {
        return bookingStatus == BookingStatus.CANCELLED && paymentStatus == BookingPaymentStatus.PAID;
    }

    public CancelledBy cancellerRole(Long userId) {
        return Objects.equals(renterId, userId) ? CancelledBy.RENTER : CancelledBy.OWNER;
    }

    /**
     * Applies a status transition and its timestamp side effects.
     * Earnings credit on completion is handled by the caller in the same transaction.
     */
    public void changeStatus(BookingStatus target, Long actingUserId, String reason, LocalDateTime now) {
        if (!bookingStatus.canTransitionTo(target)) {
            throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                    "Cannot change booking status from " + bookingStatus.getCode() + " to " + target.getCode());
        }
        if (target == BookingStatus.ACTIVE) {
            this.checkInTime = now;
        } else if (target == BookingStatus.COMPLETED) {
            this.checkOutTime = now;
        } else if (target == BookingStatus.CANCELLED) {
            this.cancelledBy = cancellerRole(actingUserId);
            this.cancellationReason = reason;
            this.cancelledAt = now;
        }
        this.bookingStatus = target;
    }

    public void cancel(Long actingUserId, String reason, LocalDateTime now) {
        if (bookingStatus.isTerminal()) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_CANCELLABLE,
                    "Booking is already " + bookingStatus.getCode());
        }
        changeStatus(BookingStatus.CANCELLED, actingUserId, reason, now);
    }

    public void attachPaymentIntent(String providerPaymentId) {
        this.providerPaymentId = providerPaymentId;
    }

    /**
     * Records the payment outcome. A successful payment confirms a pending booking;
     * later statuses are left alone so a late notification never rewinds the lifecycle.
     *
     * @return true if the booking moved from pending to confirmed
     */
    public boolean updatePaymentStatus(BookingPaymentStatus status, String providerPaymentId) {
        this.paymentStatus = status;
        if (providerPaymentId != null) {
            this.providerPaymentId = providerPaymentId;
        }
        if (status == BookingPaymentStatus.PAID && bookingStatus == BookingStatus.PENDING) {
            this.bookingStatus = BookingStatus.CONFIRMED;
            return true;
        }
        return false;
    }
}
