package com.parkalot.parking.service;

import com.parkalot.parking.jooq.BookingJooqRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * A space is available for [start, end) when no booking still holding the space overlaps it.
 * Adjacent ranges (one ends exactly when the other starts) do not overlap.
 */
@Component
@RequiredArgsConstructor
public class AvailabilityChecker {

    private final BookingJooqRepository bookingJooqRepository;

    public boolean isAvailable(Long spaceId, LocalDateTime start, LocalDateTime end) {
        return bookingJooqRepository.countOverlapping(spaceId, start, end) == 0;
    }
}
