package com.parkalot.parking.service;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.config.BookingLockProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis distributed lock per space, taken before the booking transaction so that
 * concurrent requests for one space queue here instead of on the database row lock.
 * When Redis is unavailable the booking proceeds on the row lock alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpaceLockService {

    private static final String LOCK_PREFIX = "lock:space:";

    private final RedissonClient redissonClient;
    private final BookingLockProperties lockProperties;

    /**
     * @return the held lock, or empty when Redis is unavailable
     */
    @CircuitBreaker(name = "redisLock", fallbackMethod = "acquireFallback")
    public Optional<RLock> acquire(Long spaceId) {
        RLock lock = redissonClient.getLock(LOCK_PREFIX + spaceId);
        try {
            boolean acquired = lock.tryLock(
                    lockProperties.getWaitTime().toMillis(),
                    lockProperties.getLeaseTime().toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED,
                        "Failed to acquire lock for space: " + spaceId);
            }
            return Optional.of(lock);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED, "Lock acquisition interrupted");
        }
    }

    @SuppressWarnings("unused")
    private Optional<RLock> acquireFallback(Long spaceId, Throwable t) {
        if (t instanceof BusinessException) {
            throw (BusinessException) t;
        }
        log.warn("Redis lock unavailable for space {}, relying on row lock", spaceId, t);
        return Optional.empty();
    }

    public void release(Optional<RLock> lock) {
        lock.ifPresent(held -> {
            try {
                if (held.isHeldByCurrentThread()) {
                    held.unlock();
                }
            } catch (Exception e) {
                log.warn("Failed to release lock: {}", held.getName(), e);
            }
        });
    }
}
