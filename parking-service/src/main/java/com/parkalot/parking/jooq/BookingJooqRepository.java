package com.parkalot.parking.jooq;

import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.domain.SpaceStatus;
import lombok.RequiredArgsConstructor;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.parkalot.parking.jooq.ParkingTables.Bookings;
import static com.parkalot.parking.jooq.ParkingTables.Spaces;
import static org.jooq.impl.DSL.not;

/**
 * jOOQ repository for the booking hot path: space row lock, overlap check, stat credit.
 * Locking methods MUST be called within an active transaction.
 */
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingJooqRepository {

    private static final List<String> RELEASED_STATUSES = List.of(
            BookingStatus.CANCELLED.getCode(), BookingStatus.COMPLETED.getCode());

    private final DSLContext dsl;

    /**
     * Selects the pricing and rules of a space with FOR UPDATE so that concurrent
     * bookings of the same space serialize on the row.
     */
    public Optional<LockedSpace> lockSpace(Long spaceId) {
        return dsl.select(
                        Spaces.ID,
                        Spaces.OWNER_ID,
                        Spaces.STATUS,
                        Spaces.PRICE_PER_HOUR,
                        Spaces.PRICE_PER_DAY,
                        Spaces.MIN_BOOKING_HOURS,
                        Spaces.MAX_BOOKING_DAYS)
                .from(Spaces.TABLE)
                .where(Spaces.ID.eq(spaceId))
                .forUpdate()
                .fetchOptional(r -> new LockedSpace(
                        r.get(Spaces.ID),
                        r.get(Spaces.OWNER_ID),
                        SpaceStatus.from(r.get(Spaces.STATUS)),
                        r.get(Spaces.PRICE_PER_HOUR),
                        r.get(Spaces.PRICE_PER_DAY),
                        r.get(Spaces.MIN_BOOKING_HOURS),
                        r.get(Spaces.MAX_BOOKING_DAYS)));
    }

    /**
     * Counts bookings of the space that still hold it and overlap [start, end).
     * Two ranges overlap unless one ends at or before the other starts.
     */
    public long countOverlapping(Long spaceId, LocalDateTime start, LocalDateTime end) {
        return dsl.selectCount()
                .from(Bookings.TABLE)
                .where(Bookings.SPACE_ID.eq(spaceId))
                .and(Bookings.BOOKING_STATUS.notIn(RELEASED_STATUSES))
                .and(not(Bookings.END_TIME.le(start).or(Bookings.START_TIME.ge(end))))
                .fetchOne(0, long.class);
    }

    /**
     * Adds a completed booking's payout to the space's running totals.
     */
    @Transactional
    public int creditCompletedBooking(Long spaceId, BigDecimal ownerPayout) {
        return dsl.update(Spaces.TABLE)
                .set(Spaces.TOTAL_EARNINGS, Spaces.TOTAL_EARNINGS.plus(ownerPayout))
                .set(Spaces.TOTAL_BOOKINGS, Spaces.TOTAL_BOOKINGS.plus(1))
                .where(Spaces.ID.eq(spaceId))
                .execute();
    }

    /**
     * Pending or confirmed bookings starting after now, by renter or by owner.
     */
    public long countUpcoming(Long userId, boolean asOwner, LocalDateTime now) {
        Field<Long> userColumn = asOwner ? Bookings.OWNER_ID : Bookings.RENTER_ID;
        return dsl.selectCount()
                .from(Bookings.TABLE)
                .where(userColumn.eq(userId))
                .and(Bookings.BOOKING_STATUS.in(BookingStatus.PENDING.getCode(), BookingStatus.CONFIRMED.getCode()))
                .and(Bookings.START_TIME.gt(now))
                .fetchOne(0, long.class);
    }

    public record LockedSpace(Long spaceId, Long ownerId, SpaceStatus status,
                              BigDecimal pricePerHour, BigDecimal pricePerDay,
                              Integer minBookingHours, Integer maxBookingDays) {

        public boolean isOwnedBy(Long userId) {
            return ownerId.equals(userId);
        }
    }
}
