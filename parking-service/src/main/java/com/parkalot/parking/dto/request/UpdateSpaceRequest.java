package com.parkalot.parking.dto.request;

import com.parkalot.parking.domain.SpaceType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;

/**
 * Partial update; null fields are left unchanged. Status is changed through pause/resume only.
 */
public record UpdateSpaceRequest(
        @Size(max = 200) String spaceName,
        String description,
        SpaceType spaceType,
        @Size(max = 255) String addressLine1,
        @Size(max = 255) String addressLine2,
        @Size(max = 100) String city,
        @Size(max = 20) String postcode,
        @DecimalMin("-90") @DecimalMax("90") BigDecimal latitude,
        @DecimalMin("-180") @DecimalMax("180") BigDecimal longitude,
        @Positive BigDecimal pricePerHour,
        @PositiveOrZero BigDecimal pricePerDay,
        @Min(1) Integer minBookingHours,
        @Min(1) Integer maxBookingDays,
        List<String> amenities,
        List<String> photos,
        String accessInstructions,
        @Size(max = 100) String payoutAccountId
) {
}
