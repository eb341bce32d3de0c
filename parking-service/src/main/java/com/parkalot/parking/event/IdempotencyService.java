package com.parkalot.parking.event;

import com.parkalot.parking.repository.ProcessedEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Deduplicates payment provider webhook deliveries.
 * Uses the DB primary key on event_id to survive concurrent redelivery.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final ProcessedEventRepository processedEventRepository;
    private final Clock clock;

    /**
     * Returns true if the event was already applied and should be skipped.
     */
    public boolean isDuplicate(String eventId) {
        if (eventId == null) {
            return false;
        }
        return processedEventRepository.existsById(eventId);
    }

    public void markProcessed(String eventId, String eventType) {
        if (eventId == null) {
            return;
        }
        try {
            processedEventRepository.save(new ProcessedEvent(eventId, eventType, LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            log.debug("Duplicate event insert ignored: eventId={}", eventId);
        }
    }
}
