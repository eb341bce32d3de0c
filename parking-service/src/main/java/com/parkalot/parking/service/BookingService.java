package com.parkalot.parking.service;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.domain.Space;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Booking lifecycle entry point. Transactions live in {@link BookingTransactionService};
 * events are published and refunds issued here, after the local state has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final BookingTransactionService transactionService;
    private final BookingRepository bookingRepository;
    private final SpaceRepository spaceRepository;
    private final BookingJooqRepository bookingJooqRepository;
    private final AvailabilityChecker availabilityChecker;
    private final PricingEngine pricingEngine;
    private final SpaceLockService spaceLockService;
    private final PaymentService paymentService;
    private final BookingEventProducer bookingEventProducer;
    private final Clock clock;

    /**
     * Books a space with two locks:
     * 1. Redis lock per space (cross-pod queueing, skipped when Redis is down)
     * 2. DB row lock on the space (FOR UPDATE) around the availability re-check and insert
     */
    public Booking createBooking(Long renterId, CreateBookingRequest request) {
        log.info("Create booking: renterId={}, spaceId={}, {} - {}",
                renterId, request.spaceId(), request.startTime(), request.endTime());

        pricingEngine.computeDuration(request.startTime(), request.endTime());
        if (request.startTime().isBefore(LocalDateTime.now(clock))) {
            throw new BusinessException(ErrorCode.START_TIME_IN_PAST);
        }

        Optional<RLock> lock = spaceLockService.acquire(request.spaceId());
        Booking booking;
        try {
            booking = transactionService.createInTransaction(renterId, request);
        } finally {
            spaceLockService.release(lock);
        }

        bookingEventProducer.publishBookingCreated(booking);
        return booking;
    }

    @Transactional(readOnly = true)
    public PriceQuote calculatePrice(Long spaceId, LocalDateTime start, LocalDateTime end) {
        Space space = spaceRepository.findById(spaceId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SPACE_NOT_FOUND, "Space not found: " + spaceId));
        double hours = pricingEngine.computeDuration(start, end);
        return pricingEngine.quote(hours, space.getPricePerHour(), space.getPricePerDay());
    }

    public boolean isAvailable(Long spaceId, LocalDateTime start, LocalDateTime end) {
        pricingEngine.computeDuration(start, end);
        return availabilityChecker.isAvailable(spaceId, start, end);
    }

    /**
     * Status change requested by the renter or owner. Cancellation goes through
     * {@link #cancelBooking} so the refund policy applies.
     */
    public Booking updateStatus(Long bookingId, BookingStatus newStatus, Long actingUserId, String reason) {
        if (newStatus == BookingStatus.CANCELLED) {
            cancelBooking(bookingId, actingUserId, reason);
            return getBooking(bookingId, actingUserId);
        }

        Booking booking = transactionService.updateStatusInTransaction(bookingId, newStatus, actingUserId, reason);
        if (newStatus == BookingStatus.CONFIRMED) {
            bookingEventProducer.publishBookingConfirmed(booking);
        } else if (newStatus == BookingStatus.COMPLETED) {
            bookingEventProducer.publishBookingCompleted(booking);
        }
        return booking;
    }

    public CancellationResponse cancelBooking(Long bookingId, Long actingUserId, String reason) {
        CancellationOutcome outcome = transactionService.cancelInTransaction(bookingId, actingUserId, reason);
        Booking booking = outcome.booking();
        RefundDecision refund = outcome.refund();

        boolean refundIssued = false;
        String refundId = null;
        if (refund.eligible()) {
            if (booking.getProviderPaymentId() == null) {
                log.warn("Refund due but booking has no payment reference: bookingId={}, amount={}",
                        bookingId, refund.refundAmount());
            } else {
                RefundResult result = paymentService.refundBookingPayment(booking, refund.refundAmount());
                refundIssued = result.success();
                refundId = result.refundId();
            }
        }

        bookingEventProducer.publishBookingCancelled(booking, refund.refundAmount());
        return new CancellationResponse(bookingId, refund.refundAmount(), refund.eligible(), refundIssued, refundId);
    }

    public Booking updatePaymentStatus(Long bookingId, BookingPaymentStatus status, String providerPaymentId) {
        PaymentStatusOutcome outcome = transactionService.updatePaymentStatus(bookingId, status, providerPaymentId);
        if (outcome.confirmed()) {
            bookingEventProducer.publishBookingConfirmed(outcome.booking());
        }
        return outcome.booking();
    }

    @Transactional(readOnly = true)
    public Booking getBooking(Long bookingId, Long userId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        if (!booking.isParticipant(userId)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED,
                    "User is not a participant of booking: " + bookingId);
        }
        return booking;
    }

    @Transactional(readOnly = true)
    public List<Booking> getRenterBookings(Long renterId, BookingStatus status) {
        return status != null
                ? bookingRepository.findByRenterIdAndBookingStatusOrderByStartTimeDesc(renterId, status)
                : bookingRepository.findByRenterIdOrderByStartTimeDesc(renterId);
    }

    @Transactional(readOnly = true)
    public List<Booking> getOwnerBookings(Long ownerId, BookingStatus status) {
        return status != null
                ? bookingRepository.findByOwnerIdAndBookingStatusOrderByStartTimeDesc(ownerId, status)
                : bookingRepository.findByOwnerIdOrderByStartTimeDesc(ownerId);
    }

    /**
     * Slots still held on a space ending at or after {@code from} (now when null).
     */
    @Transactional(readOnly = true)
    public List<BookedSlotResponse> getSpaceCalendar(Long spaceId, LocalDateTime from) {
        if (!spaceRepository.existsById(spaceId)) {
            throw new BusinessException(ErrorCode.SPACE_NOT_FOUND, "Space not found: " + spaceId);
        }
        LocalDateTime since = from != null ? from : LocalDateTime.now(clock);
        return bookingRepository.findSpaceCalendar(spaceId, BookingStatus.OCCUPYING, since).stream()
                .map(BookedSlotResponse::from)
                .toList();
    }

    public long getUpcomingCount(Long userId, boolean asOwner) {
        return bookingJooqRepository.countUpcoming(userId, asOwner, LocalDateTime.now(clock));
    }
}
