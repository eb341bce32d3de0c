package com.parkalot.parking.service;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.Payment;
import com.parkalot.parking.domain.PaymentStatus;
import com.parkalot.parking.repository.BookingRepository;
import com.parkalot.parking.repository.PaymentRepository;
import com.parkalot.parking.service.BookingPaymentUpdater.BookingRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Local payment state changes, each in one transaction. Provider calls happen in
 * PaymentService before these run, so a provider failure never leaves partial state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentRecordService {

    private final PaymentRepository paymentRepository;
    private final BookingRepository bookingRepository;
    private final BookingPaymentUpdater bookingPaymentUpdater;
    private final Clock clock;

    @Transactional
    public Payment recordPending(Payment payment) {
        Payment saved = paymentRepository.save(payment);
        log.info("Payment created: paymentId={}, intentId={}, type={}, amount={}",
                saved.getId(), saved.getProviderPaymentId(), saved.getBookingType().getCode(), saved.getAmount());
        return saved;
    }

    /**
     * Records a space booking payment and points the booking at the new intent.
     */
    @Transactional
    public Payment recordSpacePayment(Payment payment, Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        booking.attachPaymentIntent(payment.getProviderPaymentId());
        return recordPending(payment);
    }

    /**
     * Marks the intent's payment succeeded and the booking paid. Safe to repeat.
     *
     * @param ref booking named by the provider metadata, or null to use the payment's own
     */
    @Transactional
    public SettlementOutcome settleSucceeded(String intentId, BookingRef ref) {
        Payment payment = paymentRepository.findByProviderPaymentId(intentId).orElse(null);
        boolean changed = payment != null && payment.markSucceeded();
        if (payment == null) {
            log.warn("No payment record for succeeded intent: intentId={}", intentId);
        }

        BookingRef target = ref != null ? ref : (payment != null ? BookingRef.of(payment) : null);
        Booking confirmed = bookingPaymentUpdater.apply(target, BookingPaymentStatus.PAID, intentId);

        log.info("Payment succeeded: intentId={}, changed={}, bookingConfirmed={}",
                intentId, changed, confirmed != null);
        return new SettlementOutcome(payment, changed, confirmed);
    }

    /**
     * @return the payment when this call moved it to failed
     */
    @Transactional
    public Optional<Payment> recordFailure(String intentId, String reason) {
        Payment payment = paymentRepository.findByProviderPaymentId(intentId).orElse(null);
        if (payment == null || !payment.markFailed(reason)) {
            return Optional.empty();
        }
        bookingPaymentUpdater.apply(BookingRef.of(payment), BookingPaymentStatus.FAILED, intentId);
        log.info("Payment failed: paymentId={}, intentId={}, reason={}", payment.getId(), intentId, reason);
        return Optional.of(payment);
    }

    /**
     * Adds a refund this service issued and mirrors it on the booking.
     */
    @Transactional
    public Payment recordRefund(Long paymentId, BigDecimal refundAmount) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment not found: " + paymentId));
        if (!payment.isRefundable()) {
            throw new BusinessException(ErrorCode.PAYMENT_NOT_REFUNDABLE,
                    "Payment cannot be refunded: status=" + payment.getStatus().getCode());
        }
        PaymentStatus status = payment.recordRefund(refundAmount, LocalDateTime.now(clock));
        bookingPaymentUpdater.apply(BookingRef.of(payment), toBookingStatus(status), payment.getProviderPaymentId());
        log.info("Refund recorded: paymentId={}, amount={}, status={}", paymentId, refundAmount, status.getCode());
        return payment;
    }

    /**
     * Applies the provider's reported refund total to the payment only. Booking state is
     * updated by whoever issued the refund, which knows whether it was partial.
     *
     * @return the payment when its refund state changed
     */
    @Transactional
    public Optional<Payment> applyProviderRefund(String intentId, BigDecimal totalRefunded) {
        Payment payment = paymentRepository.findByProviderPaymentId(intentId).orElse(null);
        if (payment == null || !payment.applyProviderRefund(totalRefunded, LocalDateTime.now(clock))) {
            return Optional.empty();
        }
        log.info("Provider refund applied: paymentId={}, refunded={}, status={}",
                payment.getId(), payment.getRefundAmount(), payment.getStatus().getCode());
        return Optional.of(payment);
    }

    private BookingPaymentStatus toBookingStatus(PaymentStatus status) {
        return status == PaymentStatus.REFUNDED ? BookingPaymentStatus.REFUNDED : BookingPaymentStatus.PARTIAL_REFUND;
    }

    public record SettlementOutcome(Payment payment, boolean paymentChanged, Booking confirmedBooking) {
    }
}
