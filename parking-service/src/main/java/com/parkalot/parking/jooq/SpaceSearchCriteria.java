package com.parkalot.parking.jooq;

import com.parkalot.parking.domain.SpaceType;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Filters for searching active spaces. Null fields are not applied.
 */
@Builder
public record SpaceSearchCriteria(
        String city,
        String postcode,
        BigDecimal maxPricePerHour,
        SpaceType spaceType,
        List<String> amenities,
        Double latitude,
        Double longitude,
        Double radiusMiles,
        Integer limit,
        Integer offset
) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;
    public static final double DEFAULT_RADIUS_MILES = 10;

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public int effectiveLimit() {
        int requested = limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
        return Math.min(requested, MAX_LIMIT);
    }

    public int effectiveOffset() {
        return offset != null && offset > 0 ? offset : 0;
    }

    public double effectiveRadius() {
        return radiusMiles != null && radiusMiles > 0 ? radiusMiles : DEFAULT_RADIUS_MILES;
    }
}
