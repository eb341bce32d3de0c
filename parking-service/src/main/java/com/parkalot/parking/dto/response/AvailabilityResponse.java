package com.parkalot.parking.dto.response;

import java.time.LocalDateTime;

public record AvailabilityResponse(Long spaceId, LocalDateTime startTime, LocalDateTime endTime, boolean available) {
}
