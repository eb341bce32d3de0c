package com.parkalot.parking.event.producer;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends booking and payment notifications once the change they describe has committed.
 * <p>
 * A send counts as delivered only when the broker acknowledges it within
 * {@value #SEND_TIMEOUT_SECONDS}s; anything else is retried under {@code kafkaPublisher}.
 * When retries run out or the breaker is open the event is logged and dropped. The
 * database row stays authoritative and the caller's request still succeeds, so
 * consumers must tolerate both gaps and duplicates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResilientKafkaPublisher {

    static final int SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Retry(name = "kafkaPublisher")
    @CircuitBreaker(name = "kafkaPublisher", fallbackMethod = "publishFallback")
    public void publish(String topic, String key, Object event, String eventName) {
        try {
            kafkaTemplate.send(topic, key, event).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Published {}: topic={}, key={}", eventName, topic, key);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Broker rejected " + eventName + " on " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("No broker ack for " + eventName + " on " + topic
                    + " within " + SEND_TIMEOUT_SECONDS + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted sending " + eventName + " on " + topic, e);
        }
    }

    @SuppressWarnings("unused")
    void publishFallback(String topic, String key, Object event, String eventName, Throwable t) {
        log.error("Event not delivered, committed state unaffected: {} topic={} key={}",
                eventName, topic, key, t);
    }
}
