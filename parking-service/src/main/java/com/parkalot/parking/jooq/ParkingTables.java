package com.parkalot.parking.jooq;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.jooq.Field;
import org.jooq.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

/**
 * Table and column references for the jOOQ hot paths. Names match the JPA mapping.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ParkingTables {

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Spaces {
        public static final Table<?> TABLE = table(name("customer_spaces"));
        public static final Field<Long> ID = field(name("customer_spaces", "space_id"), Long.class);
        public static final Field<Long> OWNER_ID = field(name("customer_spaces", "owner_id"), Long.class);
        public static final Field<String> SPACE_NAME = field(name("customer_spaces", "space_name"), String.class);
        public static final Field<String> SPACE_TYPE = field(name("customer_spaces", "space_type"), String.class);
        public static final Field<String> CITY = field(name("customer_spaces", "city"), String.class);
        public static final Field<String> POSTCODE = field(name("customer_spaces", "postcode"), String.class);
        public static final Field<BigDecimal> LATITUDE = field(name("customer_spaces", "latitude"), BigDecimal.class);
        public static final Field<BigDecimal> LONGITUDE = field(name("customer_spaces", "longitude"), BigDecimal.class);
        public static final Field<BigDecimal> PRICE_PER_HOUR = field(name("customer_spaces", "price_per_hour"), BigDecimal.class);
        public static final Field<BigDecimal> PRICE_PER_DAY = field(name("customer_spaces", "price_per_day"), BigDecimal.class);
        public static final Field<Integer> MIN_BOOKING_HOURS = field(name("customer_spaces", "min_booking_hours"), Integer.class);
        public static final Field<Integer> MAX_BOOKING_DAYS = field(name("customer_spaces", "max_booking_days"), Integer.class);
        public static final Field<String> STATUS = field(name("customer_spaces", "status"), String.class);
        public static final Field<BigDecimal> TOTAL_EARNINGS = field(name("customer_spaces", "total_earnings"), BigDecimal.class);
        public static final Field<Integer> TOTAL_BOOKINGS = field(name("customer_spaces", "total_bookings"), Integer.class);
        public static final Field<BigDecimal> AVERAGE_RATING = field(name("customer_spaces", "average_rating"), BigDecimal.class);
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class SpaceAmenities {
        public static final Table<?> TABLE = table(name("customer_space_amenities"));
        public static final Field<Long> SPACE_ID = field(name("customer_space_amenities", "space_id"), Long.class);
        public static final Field<String> AMENITY = field(name("customer_space_amenities", "amenity"), String.class);
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Bookings {
        public static final Table<?> TABLE = table(name("customer_space_bookings"));
        public static final Field<Long> ID = field(name("customer_space_bookings", "booking_id"), Long.class);
        public static final Field<Long> SPACE_ID = field(name("customer_space_bookings", "space_id"), Long.class);
        public static final Field<Long> RENTER_ID = field(name("customer_space_bookings", "renter_id"), Long.class);
        public static final Field<Long> OWNER_ID = field(name("customer_space_bookings", "owner_id"), Long.class);
        public static final Field<LocalDateTime> START_TIME = field(name("customer_space_bookings", "start_time"), LocalDateTime.class);
        public static final Field<LocalDateTime> END_TIME = field(name("customer_space_bookings", "end_time"), LocalDateTime.class);
        public static final Field<BigDecimal> PLATFORM_FEE = field(name("customer_space_bookings", "platform_fee"), BigDecimal.class);
        public static final Field<BigDecimal> OWNER_PAYOUT = field(name("customer_space_bookings", "owner_payout"), BigDecimal.class);
        public static final Field<String> BOOKING_STATUS = field(name("customer_space_bookings", "booking_status"), String.class);
        public static final Field<String> PAYMENT_STATUS = field(name("customer_space_bookings", "payment_status"), String.class);
        public static final Field<LocalDateTime> CREATED_AT = field(name("customer_space_bookings", "created_at"), LocalDateTime.class);
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Payments {
        public static final Table<?> TABLE = table(name("payments"));
        public static final Field<Long> USER_ID = field(name("payments", "user_id"), Long.class);
        public static final Field<BigDecimal> AMOUNT = field(name("payments", "amount"), BigDecimal.class);
        public static final Field<BigDecimal> REFUND_AMOUNT = field(name("payments", "refund_amount"), BigDecimal.class);
        public static final Field<String> STATUS = field(name("payments", "status"), String.class);
    }

    /** Airport parking bookings, owned by the airport booking flow. */
    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class AirportBookings {
        public static final Table<?> TABLE = table(name("parking_bookings_live"));
        public static final Field<Long> ID = field(name("parking_bookings_live", "booking_id"), Long.class);
        public static final Field<String> PAYMENT_STATUS = field(name("parking_bookings_live", "payment_status"), String.class);
        public static final Field<String> BOOKING_STATUS = field(name("parking_bookings_live", "booking_status"), String.class);
        public static final Field<String> PAYMENT_INTENT_ID = field(name("parking_bookings_live", "stripe_payment_intent_id"), String.class);
    }

    /** Garage reservations, owned by the reservation flow. */
    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class GarageReservations {
        public static final Table<?> TABLE = table(name("reservations"));
        public static final Field<Long> ID = field(name("reservations", "reservation_id"), Long.class);
        public static final Field<String> STATUS = field(name("reservations", "status"), String.class);
    }
}
