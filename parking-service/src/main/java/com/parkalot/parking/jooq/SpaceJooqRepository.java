package com.parkalot.parking.jooq;

import com.parkalot.parking.domain.BookingPaymentStatus;
import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.domain.SpaceStatus;
import lombok.RequiredArgsConstructor;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.DatePart;
import org.jooq.Field;
import org.jooq.SortField;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static com.parkalot.parking.jooq.ParkingTables.Bookings;
import static com.parkalot.parking.jooq.ParkingTables.SpaceAmenities;
import static com.parkalot.parking.jooq.ParkingTables.Spaces;
import static org.jooq.impl.DSL.acos;
import static org.jooq.impl.DSL.coalesce;
import static org.jooq.impl.DSL.cos;
import static org.jooq.impl.DSL.count;
import static org.jooq.impl.DSL.exists;
import static org.jooq.impl.DSL.extract;
import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.greatest;
import static org.jooq.impl.DSL.inline;
import static org.jooq.impl.DSL.least;
import static org.jooq.impl.DSL.min;
import static org.jooq.impl.DSL.month;
import static org.jooq.impl.DSL.rad;
import static org.jooq.impl.DSL.select;
import static org.jooq.impl.DSL.selectCount;
import static org.jooq.impl.DSL.selectOne;
import static org.jooq.impl.DSL.sin;
import static org.jooq.impl.DSL.sum;
import static org.jooq.impl.DSL.year;

/**
 * jOOQ repository for space search and owner earnings aggregates.
 */
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SpaceJooqRepository {

    static final double EARTH_RADIUS_MILES = 3959;
    static final int EARNINGS_HISTORY_BUCKETS = 12;

    private static final String PAID = BookingPaymentStatus.PAID.getCode();

    private final DSLContext dsl;

    /**
     * Returns matching active space ids in result order. With a location, results are
     * restricted to the radius and ordered nearest first; otherwise by rating then popularity.
     */
    public List<SpaceSearchHit> search(SpaceSearchCriteria criteria) {
        Condition condition = Spaces.STATUS.eq(SpaceStatus.ACTIVE.getCode());

        if (hasText(criteria.city())) {
            condition = condition.and(Spaces.CITY.containsIgnoreCase(criteria.city().trim()));
        }
        if (hasText(criteria.postcode())) {
            condition = condition.and(Spaces.POSTCODE.startsWithIgnoreCase(criteria.postcode().trim()));
        }
        if (criteria.maxPricePerHour() != null) {
            condition = condition.and(Spaces.PRICE_PER_HOUR.le(criteria.maxPricePerHour()));
        }
        if (criteria.spaceType() != null) {
            condition = condition.and(Spaces.SPACE_TYPE.eq(criteria.spaceType().getCode()));
        }
        if (criteria.amenities() != null) {
            for (String amenity : criteria.amenities()) {
                if (!hasText(amenity)) {
                    continue;
                }
                condition = condition.and(exists(selectOne()
                        .from(SpaceAmenities.TABLE)
                        .where(SpaceAmenities.SPACE_ID.eq(Spaces.ID))
                        .and(SpaceAmenities.AMENITY.eq(amenity.trim()))));
            }
        }

        Field<BigDecimal> distance;
        List<SortField<?>> ordering = new ArrayList<>();
        if (criteria.hasLocation()) {
            distance = distanceMiles(criteria.latitude(), criteria.longitude());
            condition = condition.and(distance.le(BigDecimal.valueOf(criteria.effectiveRadius())));
            ordering.add(distance.asc());
        } else {
            distance = inline(null, BigDecimal.class);
            ordering.add(Spaces.AVERAGE_RATING.desc().nullsLast());
            ordering.add(Spaces.TOTAL_BOOKINGS.desc());
        }
        ordering.add(Spaces.ID.asc());

        return dsl.select(Spaces.ID, distance.as("distance_miles"))
                .from(Spaces.TABLE)
                .where(condition)
                .orderBy(ordering)
                .limit(criteria.effectiveLimit())
                .offset(criteria.effectiveOffset())
                .fetch(r -> new SpaceSearchHit(r.get(Spaces.ID), r.get("distance_miles", BigDecimal.class)));
    }

    public OwnerEarnings getOwnerEarnings(Long ownerId, LocalDateTime monthStart, LocalDateTime nextMonthStart) {
        var totals = dsl.select(
                        coalesce(sum(Spaces.TOTAL_EARNINGS), inline(BigDecimal.ZERO)),
                        coalesce(sum(Spaces.TOTAL_BOOKINGS), inline(BigDecimal.ZERO)),
                        count())
                .from(Spaces.TABLE)
                .where(Spaces.OWNER_ID.eq(ownerId))
                .fetchOne();

        BigDecimal pendingPayout = dsl.select(coalesce(sum(Bookings.OWNER_PAYOUT), inline(BigDecimal.ZERO)))
                .from(Bookings.TABLE)
                .where(Bookings.OWNER_ID.eq(ownerId))
                .and(Bookings.PAYMENT_STATUS.eq(PAID))
                .and(Bookings.BOOKING_STATUS.in(BookingStatus.COMPLETED.getCode(), BookingStatus.ACTIVE.getCode()))
                .fetchOne(0, BigDecimal.class);

        BigDecimal monthEarnings = dsl.select(coalesce(sum(Bookings.OWNER_PAYOUT), inline(BigDecimal.ZERO)))
                .from(Bookings.TABLE)
                .where(Bookings.OWNER_ID.eq(ownerId))
                .and(Bookings.PAYMENT_STATUS.eq(PAID))
                .and(Bookings.CREATED_AT.ge(monthStart))
                .and(Bookings.CREATED_AT.lt(nextMonthStart))
                .fetchOne(0, BigDecimal.class);

        return new OwnerEarnings(
                totals.value1(),
                totals.value2().longValue(),
                totals.value3(),
                pendingPayout,
                monthEarnings);
    }

    public List<SpaceEarnings> getEarningsBySpace(Long ownerId, LocalDateTime monthStart, LocalDateTime nextMonthStart) {
        Field<BigDecimal> monthEarnings = field(select(coalesce(sum(Bookings.OWNER_PAYOUT), inline(BigDecimal.ZERO)))
                .from(Bookings.TABLE)
                .where(Bookings.SPACE_ID.eq(Spaces.ID))
                .and(Bookings.PAYMENT_STATUS.eq(PAID))
                .and(Bookings.CREATED_AT.ge(monthStart))
                .and(Bookings.CREATED_AT.lt(nextMonthStart)))
                .as("month_earnings");

        Field<Integer> activeBookings = field(selectCount()
                .from(Bookings.TABLE)
                .where(Bookings.SPACE_ID.eq(Spaces.ID))
                .and(Bookings.BOOKING_STATUS.in(BookingStatus.OCCUPYING.stream().map(BookingStatus::getCode).toList())))
                .as("active_bookings");

        return dsl.select(
                        Spaces.ID,
                        Spaces.SPACE_NAME,
                        Spaces.CITY,
                        Spaces.TOTAL_EARNINGS,
                        Spaces.TOTAL_BOOKINGS,
                        Spaces.AVERAGE_RATING,
                        Spaces.STATUS,
                        monthEarnings,
                        activeBookings)
                .from(Spaces.TABLE)
                .where(Spaces.OWNER_ID.eq(ownerId))
                .orderBy(Spaces.TOTAL_EARNINGS.desc(), Spaces.ID.asc())
                .fetch(r -> new SpaceEarnings(
                        r.get(Spaces.ID),
                        r.get(Spaces.SPACE_NAME),
                        r.get(Spaces.CITY),
                        r.get(Spaces.TOTAL_EARNINGS),
                        r.get(Spaces.TOTAL_BOOKINGS),
                        r.get(Spaces.AVERAGE_RATING),
                        SpaceStatus.from(r.get(Spaces.STATUS)),
                        r.get(monthEarnings),
                        r.get(activeBookings)));
    }

    /**
     * Paid bookings of an owner bucketed by creation date. Returns the most recent
     * {@value #EARNINGS_HISTORY_BUCKETS} buckets, oldest first.
     */
    public List<PeriodEarnings> getEarningsByPeriod(Long ownerId, EarningsPeriod period) {
        Field<Integer> yearOf = year(Bookings.CREATED_AT);
        Field<Integer> bucket;
        List<Field<?>> groupBy = new ArrayList<>();
        groupBy.add(yearOf);
        if (period == EarningsPeriod.WEEK) {
            bucket = extract(Bookings.CREATED_AT, DatePart.WEEK);
            groupBy.add(bucket);
        } else if (period == EarningsPeriod.YEAR) {
            bucket = yearOf;
        } else {
            bucket = month(Bookings.CREATED_AT);
            groupBy.add(bucket);
        }

        Field<BigDecimal> earnings = coalesce(sum(Bookings.OWNER_PAYOUT), inline(BigDecimal.ZERO)).as("earnings");
        Field<Integer> bookings = count().as("bookings");
        Field<BigDecimal> platformFees = coalesce(sum(Bookings.PLATFORM_FEE), inline(BigDecimal.ZERO)).as("platform_fees");

        List<Field<?>> selected = new ArrayList<>(groupBy);
        selected.add(earnings);
        selected.add(bookings);
        selected.add(platformFees);

        List<PeriodEarnings> newestFirst = dsl.select(selected)
                .from(Bookings.TABLE)
                .where(Bookings.OWNER_ID.eq(ownerId))
                .and(Bookings.PAYMENT_STATUS.eq(PAID))
                .groupBy(groupBy)
                .orderBy(min(Bookings.CREATED_AT).desc())
                .limit(EARNINGS_HISTORY_BUCKETS)
                .fetch(r -> new PeriodEarnings(
                        periodLabel(period, r.get(yearOf), r.get(bucket)),
                        r.get(earnings),
                        r.get(bookings),
                        r.get(platformFees)));

        List<PeriodEarnings> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }

    static String periodLabel(EarningsPeriod period, int year, int bucket) {
        if (period == EarningsPeriod.WEEK) {
            return year + " W" + bucket;
        }
        if (period == EarningsPeriod.YEAR) {
            return String.valueOf(year);
        }
        return Month.of(bucket).getDisplayName(TextStyle.SHORT, Locale.ENGLISH) + " " + year;
    }

    /**
     * Great-circle distance from the given point, clamped so rounding never pushes acos out of range.
     */
    private Field<BigDecimal> distanceMiles(double latitude, double longitude) {
        Field<BigDecimal> cosine = cos(rad(inline(latitude)))
                .mul(cos(rad(Spaces.LATITUDE)))
                .mul(cos(rad(Spaces.LONGITUDE).minus(rad(inline(longitude)))))
                .plus(sin(rad(inline(latitude))).mul(sin(rad(Spaces.LATITUDE))));
        Field<BigDecimal> clamped = least(inline(BigDecimal.ONE), greatest(inline(BigDecimal.ONE.negate()), cosine));
        return inline(BigDecimal.valueOf(EARTH_RADIUS_MILES)).mul(acos(clamped));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public record SpaceSearchHit(Long spaceId, BigDecimal distanceMiles) {
    }

    public record OwnerEarnings(BigDecimal totalEarnings, long totalBookings, long totalSpaces,
                                BigDecimal pendingPayout, BigDecimal monthEarnings) {
    }

    public record PeriodEarnings(String periodLabel, BigDecimal earnings, long bookings, BigDecimal platformFees) {
    }

    public record SpaceEarnings(Long spaceId, String spaceName, String city, BigDecimal totalEarnings,
                                Integer totalBookings, BigDecimal averageRating, SpaceStatus status,
                                BigDecimal monthEarnings, Integer activeBookings) {
    }
}
