package com.parkalot.parking;

import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingType;
import com.parkalot.parking.domain.Payment;
import com.parkalot.parking.domain.Space;
import com.parkalot.parking.domain.SpaceStatus;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Shared test utility for creating entities with preset IDs and state.
 */
public final class TestFixtures {

    private TestFixtures() {}

    public static void setEntityId(Object entity, Long id) {
        setField(entity, "id", id);
    }

    public static void setField(Object target, String name, Object value) {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(name);
                field.setAccessible(true);
                field.set(target, value);
                return;
            } catch (NoSuchFieldException e) {
                type = type.getSuperclass();
            } catch (IllegalAccessException e) {
                throw new RuntimeException("Failed to set " + name + " on " + target.getClass().getSimpleName(), e);
            }
        }
        throw new IllegalArgumentException("No field " + name + " on " + target.getClass().getSimpleName());
    }

    public static Space createSpace(Long id, Long ownerId, SpaceStatus status, BigDecimal hourly, BigDecimal daily) {
        Space space = Space.builder()
                .ownerId(ownerId)
                .spaceName("Driveway " + id)
                .addressLine1("1 High Street")
                .city("London")
                .postcode("SW1A 1AA")
                .pricePerHour(hourly)
                .pricePerDay(daily)
                .build();
        setEntityId(space, id);
        setField(space, "status", status);
        return space;
    }

    public static Booking createBooking(Long id, Long spaceId, Long renterId, Long ownerId,
                                        LocalDateTime start, LocalDateTime end, BigDecimal total) {
        BigDecimal fee = total.multiply(new BigDecimal("0.15")).setScale(2, RoundingMode.HALF_UP);
        Booking booking = Booking.builder()
                .spaceId(spaceId)
                .renterId(renterId)
                .ownerId(ownerId)
                .startTime(start)
                .endTime(end)
                .totalPrice(total)
                .platformFee(fee)
                .ownerPayout(total.subtract(fee))
                .build();
        setEntityId(booking, id);
        return booking;
    }

    public static Payment createPayment(Long id, Long userId, BookingType type, Long bookingId,
                                        BigDecimal amount, String intentId) {
        Payment payment = Payment.builder()
                .userId(userId)
                .bookingType(type)
                .bookingId(bookingId)
                .amount(amount)
                .currency("gbp")
                .providerPaymentId(intentId)
                .build();
        setEntityId(payment, id);
        return payment;
    }
}
