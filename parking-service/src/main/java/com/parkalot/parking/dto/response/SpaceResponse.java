package com.parkalot.parking.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.parkalot.parking.domain.Space;
import com.parkalot.parking.domain.SpaceStatus;
import com.parkalot.parking.domain.SpaceType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record SpaceResponse(
        Long spaceId,
        Long ownerId,
        String spaceName,
        String description,
        SpaceType spaceType,
        String addressLine1,
        String addressLine2,
        String city,
        String postcode,
        BigDecimal latitude,
        BigDecimal longitude,
        BigDecimal pricePerHour,
        BigDecimal pricePerDay,
        int minBookingHours,
        int maxBookingDays,
        List<String> amenities,
        List<String> photos,
        String accessInstructions,
        SpaceStatus status,
        BigDecimal totalEarnings,
        int totalBookings,
        BigDecimal averageRating,
        @JsonInclude(JsonInclude.Include.NON_NULL) BigDecimal distanceMiles,
        LocalDateTime createdAt
) {
    public static SpaceResponse from(Space space) {
        return from(space, null);
    }

    public static SpaceResponse from(Space space, BigDecimal distanceMiles) {
        return new SpaceResponse(
                space.getId(),
                space.getOwnerId(),
                space.getSpaceName(),
                space.getDescription(),
                space.getSpaceType(),
                space.getAddressLine1(),
                space.getAddressLine2(),
                space.getCity(),
                space.getPostcode(),
                space.getLatitude(),
                space.getLongitude(),
                space.getPricePerHour(),
                space.getPricePerDay(),
                space.getMinBookingHours(),
                space.getMaxBookingDays(),
                List.copyOf(space.getAmenities()),
                List.copyOf(space.getPhotos()),
                space.getAccessInstructions(),
                space.getStatus(),
                space.getTotalEarnings(),
                space.getTotalBookings(),
                space.getAverageRating(),
                distanceMiles,
                space.getCreatedAt()
        );
    }
}
