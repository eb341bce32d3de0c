package com.parkalot.parking.event;

import com.parkalot.parking.repository.ProcessedEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 9, 0);

    @Mock
    private ProcessedEventRepository processedEventRepository;

    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        idempotencyService = new IdempotencyService(processedEventRepository,
                Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    void isDuplicate_eventExists_returnsTrue() {
        given(processedEventRepository.existsById("evt_1")).willReturn(true);

        assertThat(idempotencyService.isDuplicate("evt_1")).isTrue();
    }

    @Test
    void isDuplicate_eventNotExists_returnsFalse() {
        given(processedEventRepository.existsById("evt_1")).willReturn(false);

        assertThat(idempotencyService.isDuplicate("evt_1")).isFalse();
    }

    @Test
    void isDuplicate_nullEventId_returnsFalse() {
        assertThat(idempotencyService.isDuplicate(null)).isFalse();
        verify(processedEventRepository, never()).existsById(any());
    }

    @Test
    void markProcessed_savesEventWithClockTime() {
        idempotencyService.markProcessed("evt_1", "payment_intent.succeeded");

        ArgumentCaptor<ProcessedEvent> captor = ArgumentCaptor.forClass(ProcessedEvent.class);
        verify(processedEventRepository).save(captor.capture());
        assertThat(captor.getValue().getEventId()).isEqualTo("evt_1");
        assertThat(captor.getValue().getProcessedAt()).isEqualTo(NOW);
    }

    @Test
    void markProcessed_duplicateInsert_ignoredGracefully() {
        doThrow(new DataIntegrityViolationException("Duplicate"))
                .when(processedEventRepository).save(any(ProcessedEvent.class));

        idempotencyService.markProcessed("evt_1", "charge.refunded");

        verify(processedEventRepository).save(any(ProcessedEvent.class));
    }

    @Test
    void markProcessed_nullEventId_noOp() {
        idempotencyService.markProcessed(null, "charge.refunded");

        verify(processedEventRepository, never()).save(any());
    }
}
