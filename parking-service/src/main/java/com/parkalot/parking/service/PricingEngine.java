package com.parkalot.parking.service;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.domain.BookingPaymentStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Booking duration, price, platform fee and refund rules. Stateless; never touches storage.
 * Money is rounded half-up to 2 decimals.
 */
@Component
public class PricingEngine {

    public static final BigDecimal PLATFORM_FEE_RATE = new BigDecimal("0.15");

    private static final double DAILY_RATE_MIN_HOURS = 8;
    private static final long DAILY_RATE_REMAINDER_HOURS = 8;
    private static final BigDecimal HOURS_PER_DAY_RATE_CHECK = BigDecimal.valueOf(8);
    private static final double FULL_REFUND_HOURS = 24;
    private static final double PARTIAL_REFUND_HOURS = 6;
    private static final BigDecimal PARTIAL_REFUND_RATE = new BigDecimal("0.5");
    private static final BigDecimal RENTER_TOTAL_MULTIPLIER = BigDecimal.ONE.add(PLATFORM_FEE_RATE);

    public double computeDuration(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null || !end.isAfter(start)) {
            throw new BusinessException(ErrorCode.INVALID_TIME_RANGE);
        }
        return Duration.between(start, end).getSeconds() / 3600.0;
    }

    /**
     * Chooses between the daily and hourly rate.
     * The daily rate applies from 8 hours when either the whole-hour remainder past full days
     * exceeds 8 hours or the daily rate is below 8 hours at the hourly rate.
     */
    public BigDecimal computePrice(double hours, BigDecimal hourlyRate, BigDecimal dailyRate) {
        if (dailyRate != null && dailyRate.signum() > 0 && hours >= DAILY_RATE_MIN_HOURS) {
            long days = (long) Math.ceil(hours / 24);
            long remaining = ((long) hours) % 24;
            if (remaining > DAILY_RATE_REMAINDER_HOURS
                    || dailyRate.compareTo(hourlyRate.multiply(HOURS_PER_DAY_RATE_CHECK)) < 0) {
                return money(dailyRate.multiply(BigDecimal.valueOf(days)));
            }
        }
        return money(BigDecimal.valueOf(hours).multiply(hourlyRate));
    }

    public FeeSplit splitPlatformFee(BigDecimal total) {
        return splitPlatformFee(total, PLATFORM_FEE_RATE);
    }

    public FeeSplit splitPlatformFee(BigDecimal total, BigDecimal feeRate) {
        BigDecimal fee = money(total.multiply(feeRate));
        BigDecimal payout = money(total.subtract(fee));
        return new FeeSplit(fee, payout);
    }

    /**
     * Full refund from 24 hours before start, half from 6 hours, nothing after that.
     * Only paid bookings are refundable.
     */
    public RefundDecision computeRefund(BigDecimal totalPrice, BookingPaymentStatus paymentStatus,
                                        LocalDateTime startTime, LocalDateTime now) {
        if (paymentStatus != BookingPaymentStatus.PAID) {
            return RefundDecision.none();
        }
        double hoursUntilStart = Duration.between(now, startTime).getSeconds() / 3600.0;

        BigDecimal refund;
        if (hoursUntilStart >= FULL_REFUND_HOURS) {
            refund = money(totalPrice);
        } else if (hoursUntilStart >= PARTIAL_REFUND_HOURS) {
            refund = money(totalPrice.multiply(PARTIAL_REFUND_RATE));
        } else {
            refund = money(BigDecimal.ZERO);
        }
        return new RefundDecision(refund, refund.signum() > 0);
    }

    /**
     * Renter-facing preview: the service fee is added on top of the subtotal.
     * The subtotal equals the total price a booking for the same times is created with.
     */
    public PriceQuote quote(double hours, BigDecimal hourlyRate, BigDecimal dailyRate) {
        BigDecimal subtotal = computePrice(hours, hourlyRate, dailyRate);
        return new PriceQuote(
                BigDecimal.valueOf(hours).setScale(2, RoundingMode.HALF_UP),
                hourlyRate,
                dailyRate,
                subtotal,
                money(subtotal.multiply(PLATFORM_FEE_RATE)),
                money(subtotal.multiply(RENTER_TOTAL_MULTIPLIER)));
    }

    public static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    public record FeeSplit(BigDecimal platformFee, BigDecimal ownerPayout) {
    }

    public record RefundDecision(BigDecimal refundAmount, boolean eligible) {

        public static RefundDecision none() {
            return new RefundDecision(money(BigDecimal.ZERO), false);
        }
    }

    public record PriceQuote(BigDecimal hours, BigDecimal hourlyRate, BigDecimal dailyRate,
                             BigDecimal subtotal, BigDecimal serviceFee, BigDecimal quotedRenterTotal) {
    }
}
