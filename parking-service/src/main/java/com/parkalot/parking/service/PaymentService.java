package com.parkalot.parking.service;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.config.PaymentProperties;
import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.domain.BookingType;
import com.parkalot.parking.domain.Payment;
import com.parkalot.parking.domain.PaymentStatus;
import com.parkalot.parking.domain.Space;
import com.parkalot.parking.dto.request.CreatePaymentIntentRequest;
import com.parkalot.parking.dto.request.RefundRequest;
import com.parkalot.parking.dto.response.ConfirmPaymentResponse;
import com.parkalot.parking.dto.response.PaymentConfigResponse;
import com.parkalot.parking.dto.response.PaymentHistoryResponse;
import com.parkalot.parking.dto.response.PaymentIntentResponse;
import com.parkalot.parking.dto.response.PaymentResponse;
import com.parkalot.parking.dto.response.RefundResponse;
import com.parkalot.parking.event.producer.BookingEventProducer;
import com.parkalot.parking.event.producer.PaymentEventProducer;
import com.parkalot.parking.jooq.PaymentJooqRepository;
import com.parkalot.parking.jooq.PaymentJooqRepository.PaymentStats;
import com.parkalot.parking.repository.BookingRepository;
import com.parkalot.parking.repository.PaymentRepository;
import com.parkalot.parking.repository.SpaceRepository;
import com.parkalot.parking.service.PaymentGateway.IntentRequest;
import com.parkalot.parking.service.PaymentGateway.IntentResult;
import com.parkalot.parking.service.PaymentGateway.IntentStatus;
import com.parkalot.parking.service.PaymentGateway.RefundResult;
import com.parkalot.parking.service.PaymentRecordService.SettlementOutcome;
import com.parkalot.parking.service.PricingEngine.FeeSplit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payment use cases. Provider calls are made outside any transaction; local state is
 * written afterwards through {@link PaymentRecordService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    static final String DEFAULT_REFUND_REASON = "requested_by_customer";
    private static final int MAX_PAGE_SIZE = 100;

    private final PaymentGateway paymentGateway;
    private final PaymentRecordService paymentRecordService;
    private final PaymentRepository paymentRepository;
    private final PaymentJooqRepository paymentJooqRepository;
    private final BookingRepository bookingRepository;
    private final SpaceRepository spaceRepository;
    private final PricingEngine pricingEngine;
    private final PaymentEventProducer paymentEventProducer;
    private final BookingEventProducer bookingEventProducer;
    private final PaymentProperties paymentProperties;

    public PaymentIntentResponse createIntent(Long userId, CreatePaymentIntentRequest request) {
        if (request.amount() == null || request.amount().signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Valid amount required");
        }
        BigDecimal amount = PricingEngine.money(request.amount());

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("user_id", String.valueOf(userId));
        metadata.put("booking_type", request.bookingType().getCode());
        if (request.bookingId() != null) {
            metadata.put("booking_id", String.valueOf(request.bookingId()));
        }
        if (request.spaceId() != null) {
            metadata.put("space_id", String.valueOf(request.spaceId()));
        }

        String description = describe(request.bookingType());
        IntentResult result = paymentGateway.createIntent(new IntentRequest(amount, description, null, metadata));
        requireSuccess(result);

        Payment payment = paymentRecordService.recordPending(Payment.builder()
                .userId(userId)
                .bookingType(request.bookingType())
                .bookingId(request.bookingId())
                .amount(amount)
                .currency(paymentProperties.getCurrency())
                .providerPaymentId(result.intentId())
                .description(description)
                .metadata(metadata)
                .build());

        return toResponse(payment, result, null);
    }

    /**
     * Payment for a customer space booking. The amount is the booking's total; when the
     * owner has a payout account the owner's share is transferred to it.
     */
    public PaymentIntentResponse createSpacePayment(Long userId, Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        if (!booking.getRenterId().equals(userId)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Only the renter can pay for booking: " + bookingId);
        }
        if (booking.getPaymentStatus() != BookingPaymentStatus.PENDING
                && booking.getPaymentStatus() != BookingPaymentStatus.FAILED) {
            throw new BusinessException(ErrorCode.BOOKING_ALREADY_PAID);
        }
        if (booking.getBookingStatus() != BookingStatus.PENDING) {
            throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                    "Booking is " + booking.getBookingStatus().getCode());
        }
        Space space = spaceRepository.findById(booking.getSpaceId())
                .orElseThrow(() -> new BusinessException(ErrorCode.SPACE_NOT_FOUND,
                        "Space not found: " + booking.getSpaceId()));

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("user_id", String.valueOf(userId));
        metadata.put("booking_type", BookingType.CUSTOMER_SPACE.getCode());
        metadata.put("booking_id", String.valueOf(bookingId));
        metadata.put("space_id", String.valueOf(space.getId()));
        metadata.put("owner_id", String.valueOf(space.getOwnerId()));

        String description = "ParkaLot - " + space.getSpaceName();
        IntentRequest intentRequest = new IntentRequest(booking.getTotalPrice(), description, null, metadata);

        IntentResult result;
        FeeSplit split = null;
        if (space.hasPayoutAccount()) {
            split = pricingEngine.splitPlatformFee(booking.getTotalPrice());
            result = paymentGateway.createConnectIntent(intentRequest, space.getPayoutAccountId(), split.platformFee());
        } else {
            result = paymentGateway.createIntent(intentRequest);
        }
        requireSuccess(result);

        Payment payment = paymentRecordService.recordSpacePayment(Payment.builder()
                .userId(userId)
                .bookingType(BookingType.CUSTOMER_SPACE)
                .bookingId(bookingId)
                .amount(booking.getTotalPrice())
                .currency(paymentProperties.getCurrency())
                .providerPaymentId(result.intentId())
                .description(description)
                .metadata(metadata)
                .build(), bookingId);

        return toResponse(payment, result, split);
    }

    /**
     * Checks the intent with the provider and, once succeeded, applies the same update
     * as the payment webhook.
     */
    public ConfirmPaymentResponse confirmPayment(Long userId, String paymentIntentId) {
        Payment payment = paymentRepository.findByProviderPaymentId(paymentIntentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment not found: " + paymentIntentId));
        if (!payment.isOwnedBy(userId)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Payment belongs to another user");
        }

        IntentStatus intent = paymentGateway.getIntent(paymentIntentId);
        if (!intent.success()) {
            throw new BusinessException(ErrorCode.PAYMENT_PROVIDER_ERROR, intent.errorMessage());
        }
        if (!intent.isSucceeded()) {
            return new ConfirmPaymentResponse(paymentIntentId, intent.status(), false, false);
        }

        SettlementOutcome outcome = paymentRecordService.settleSucceeded(paymentIntentId, null);
        publishSettlement(outcome);
        return new ConfirmPaymentResponse(paymentIntentId, intent.status(), true, outcome.confirmedBooking() != null);
    }

    public RefundResponse refund(Long userId, RefundRequest request) {
        Payment payment = findForRefund(request);
        if (!payment.isOwnedBy(userId)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Payment belongs to another user");
        }
        if (payment.getStatus() == PaymentStatus.REFUNDED) {
            throw new BusinessException(ErrorCode.PAYMENT_ALREADY_REFUNDED);
        }
        if (!payment.isRefundable()) {
            throw new BusinessException(ErrorCode.PAYMENT_NOT_REFUNDABLE,
                    "Payment cannot be refunded: status=" + payment.getStatus().getCode());
        }
        BigDecimal amount = request.amount() != null ? PricingEngine.money(request.amount()) : payment.refundableAmount();
        if (amount.compareTo(payment.refundableAmount()) > 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Refund exceeds refundable amount: " + payment.refundableAmount());
        }

        String reason = request.reason() != null ? request.reason() : DEFAULT_REFUND_REASON;
        RefundResult result = paymentGateway.refund(payment.getProviderPaymentId(), amount, reason);
        if (!result.success()) {
            throw new BusinessException(ErrorCode.REFUND_FAILED, result.errorMessage());
        }

        Payment refunded = paymentRecordService.recordRefund(payment.getId(), amount);
        paymentEventProducer.publishPaymentRefunded(refunded);
        return new RefundResponse(refunded.getId(), result.refundId(), amount, refunded.getStatus());
    }

    /**
     * Refund triggered by a booking cancellation. The cancellation has already committed,
     * so failures are reported in the result rather than thrown.
     */
    public RefundResult refundBookingPayment(Booking booking, BigDecimal amount) {
        String intentId = booking.getProviderPaymentId();
        RefundResult result = paymentGateway.refund(intentId, amount, DEFAULT_REFUND_REASON);
        if (!result.success()) {
            log.warn("Cancellation refund failed: bookingId={}, intentId={}, error={}",
                    booking.getId(), intentId, result.errorMessage());
            return result;
        }

        Payment payment = paymentRepository.findByProviderPaymentId(intentId).orElse(null);
        if (payment == null) {
            log.warn("Refund issued without payment record: bookingId={}, intentId={}", booking.getId(), intentId);
            return result;
        }
        try {
            Payment refunded = paymentRecordService.recordRefund(payment.getId(), amount);
            paymentEventProducer.publishPaymentRefunded(refunded);
        } catch (RuntimeException e) {
            // the provider refund stands; the charge.refunded webhook reconciles the record
            log.error("Failed to record cancellation refund: bookingId={}, paymentId={}, refundId={}",
                    booking.getId(), payment.getId(), result.refundId(), e);
        }
        return result;
    }

    @Transactional(readOnly = true)
    public PaymentHistoryResponse getHistory(Long userId, int page, int size) {
        int pageSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        List<PaymentResponse> payments = paymentRepository
                .findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(Math.max(page, 0), pageSize))
                .map(PaymentResponse::from)
                .getContent();
        return new PaymentHistoryResponse(payments, getStats(userId), payments.size());
    }

    public PaymentStats getStats(Long userId) {
        return paymentJooqRepository.getUserStats(userId);
    }

    public PaymentConfigResponse getConfig() {
        return new PaymentConfigResponse(paymentProperties.getPublishableKey(), paymentProperties.getCurrency(),
                paymentGateway.isTestMode());
    }

    private void publishSettlement(SettlementOutcome outcome) {
        if (outcome.paymentChanged()) {
            paymentEventProducer.publishPaymentSucceeded(outcome.payment());
        }
        if (outcome.confirmedBooking() != null) {
            bookingEventProducer.publishBookingConfirmed(outcome.confirmedBooking());
        }
    }

    private Payment findForRefund(RefundRequest request) {
        if (request.paymentId() != null) {
            return paymentRepository.findById(request.paymentId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                            "Payment not found: " + request.paymentId()));
        }
        return paymentRepository.findByProviderPaymentId(request.paymentIntentId())
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment not found: " + request.paymentIntentId()));
    }

    private void requireSuccess(IntentResult result) {
        if (!result.success()) {
            log.warn("Payment intent creation failed: {}", result.errorMessage());
            throw new BusinessException(ErrorCode.PAYMENT_PROVIDER_ERROR,
                    result.errorMessage() != null ? result.errorMessage() : ErrorCode.PAYMENT_PROVIDER_ERROR.getMessage());
        }
    }

    private PaymentIntentResponse toResponse(Payment payment, IntentResult result, FeeSplit split) {
        return new PaymentIntentResponse(
                payment.getId(),
                result.intentId(),
                result.clientSecret(),
                result.amount() != null ? result.amount() : payment.getAmount(),
                result.currency() != null ? result.currency() : payment.getCurrency(),
                result.status(),
                result.testMode(),
                split != null ? split.platformFee() : null,
                split != null ? split.ownerPayout() : null);
    }

    private static String describe(BookingType bookingType) {
        if (bookingType == BookingType.CUSTOMER_SPACE) {
            return "ParkaLot - Private Parking Space Booking";
        }
        if (bookingType == BookingType.AIRPORT) {
            return "ParkaLot - Airport Parking Booking";
        }
        return "ParkaLot - Garage Parking Booking";
    }
}
