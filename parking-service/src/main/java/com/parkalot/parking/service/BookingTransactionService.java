package com.parkalot.parking.service;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.domain.SpaceStatus;
import com.parkalot.parking.dto.request.CreateBookingRequest;
import com.parkalot.parking.jooq.BookingJooqRepository;
import com.parkalot.parking.jooq.BookingJooqRepository.LockedSpace;
import com.parkalot.parking.repository.BookingRepository;
import com.parkalot.parking.service.PricingEngine.FeeSplit;
import com.parkalot.parking.service.PricingEngine.RefundDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Read-then-write booking operations, each in one transaction.
 * Separated from BookingService to ensure @Transactional works
 * (avoids Spring AOP self-invocation bypass).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingTransactionService {

    private static final int HOURS_PER_DAY = 24;

    private final BookingRepository bookingRepository;
    private final BookingJooqRepository bookingJooqRepository;
    private final AvailabilityChecker availabilityChecker;
    private final PricingEngine pricingEngine;
    private final Clock clock;

    /**
     * Re-validates the space and the time slot under the space row lock, then inserts
     * the pending booking with its price split.
     */
    @Transactional
    public Booking createInTransaction(Long renterId, CreateBookingRequest request) {
        LockedSpace space = bookingJooqRepository.lockSpace(request.spaceId())
                .orElseThrow(() -> new BusinessException(ErrorCode.SPACE_NOT_FOUND,
                        "Space not found: " + request.spaceId()));

        if (space.status() != SpaceStatus.ACTIVE) {
            throw new BusinessException(ErrorCode.SPACE_NOT_ACTIVE);
        }
        if (space.isOwnedBy(renterId)) {
            throw new BusinessException(ErrorCode.CANNOT_BOOK_OWN_SPACE);
        }

        double hours = pricingEngine.computeDuration(request.startTime(), request.endTime());
        validateDuration(space, hours);

        if (!availabilityChecker.isAvailable(space.spaceId(), request.startTime(), request.endTime())) {
            throw new BusinessException(ErrorCode.SPACE_UNAVAILABLE);
        }

        BigDecimal totalPrice = pricingEngine.computePrice(hours, space.pricePerHour(), space.pricePerDay());
        FeeSplit split = pricingEngine.splitPlatformFee(totalPrice);

        Booking booking = Booking.builder()
                .spaceId(space.spaceId())
                .renterId(renterId)
                .ownerId(space.ownerId())
                .startTime(request.startTime())
                .endTime(request.endTime())
                .vehicle(request.vehicle())
                .totalPrice(totalPrice)
                .platformFee(split.platformFee())
                .ownerPayout(split.ownerPayout())
                .renterNotes(request.renterNotes())
                .build();

        booking = bookingRepository.save(booking);
        log.info("Booking created: bookingId={}, spaceId={}, renterId={}, total={}",
                booking.getId(), space.spaceId(), renterId, totalPrice);
        return booking;
    }

    /**
     * Applies a participant-requested status change. Completion credits the space's
     * earnings and booking count in the same transaction.
     */
    @Transactional
    public Booking updateStatusInTransaction(Long bookingId, BookingStatus newStatus,
                                             Long actingUserId, String reason) {
        Booking booking = loadForParticipant(bookingId, actingUserId);
        booking.changeStatus(newStatus, actingUserId, reason, LocalDateTime.now(clock));

        if (newStatus == BookingStatus.COMPLETED) {
            bookingJooqRepository.creditCompletedBooking(booking.getSpaceId(), booking.getOwnerPayout());
        }

        log.info("Booking status changed: bookingId={}, status={}, actor={}",
                bookingId, newStatus.getCode(), actingUserId);
        return booking;
    }

    @Transactional
    public CancellationOutcome cancelInTransaction(Long bookingId, Long actingUserId, String reason) {
        Booking booking = loadForParticipant(bookingId, actingUserId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (booking.getBookingStatus().isTerminal()) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_CANCELLABLE,
                    "Booking is already " + booking.getBookingStatus().getCode());
        }

        RefundDecision refund = pricingEngine.computeRefund(
                booking.getTotalPrice(), booking.getPaymentStatus(), booking.getStartTime(), now);
        booking.cancel(actingUserId, reason, now);

        log.info("Booking cancelled: bookingId={}, by={}, refund={}",
                bookingId, booking.getCancelledBy().getCode(), refund.refundAmount());
        return new CancellationOutcome(booking, refund);
    }

    /**
     * @return the booking, flagged when this update confirmed it
     */
    @Transactional
    public PaymentStatusOutcome updatePaymentStatus(Long bookingId, BookingPaymentStatus status,
                                                    String providerPaymentId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        boolean confirmed = booking.updatePaymentStatus(status, providerPaymentId);
        log.info("Booking payment status updated: bookingId={}, paymentStatus={}, confirmed={}",
                bookingId, status.getCode(), confirmed);
        return new PaymentStatusOutcome(booking, confirmed);
    }

    private Booking loadForParticipant(Long bookingId, Long actingUserId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        if (!booking.isParticipant(actingUserId)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED,
                    "User is not a participant of booking: " + bookingId);
        }
        return booking;
    }

    private void validateDuration(LockedSpace space, double hours) {
        if (space.minBookingHours() != null && hours < space.minBookingHours()) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_DURATION,
                    "Minimum booking is " + space.minBookingHours() + " hour(s)");
        }
        if (space.maxBookingDays() != null && hours > (double) space.maxBookingDays() * HOURS_PER_DAY) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_DURATION,
                    "Maximum booking is " + space.maxBookingDays() + " day(s)");
        }
    }

    public record CancellationOutcome(Booking booking, RefundDecision refund) {
    }

    public record PaymentStatusOutcome(Booking booking, boolean confirmed) {
    }
}
