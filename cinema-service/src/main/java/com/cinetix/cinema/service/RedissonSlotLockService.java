package com.cinetix.cinema.service;

import com.cinetix.cinema.config.SlotLockProperties;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Redis distributed lock. Circuit breaker protects against Redis outages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "cinema.slot-lock", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedissonSlotLockService implements SlotLockService {

    private final RedissonClient redissonClient;
    private final SlotLockProperties properties;

    @Override
    @CircuitBreaker(name = "redisLock", fallbackMethod = "acquireLocksFallback")
    public List<RLock> acquireLocks(Collection<String> keys) {
        List<RLock> acquiredLocks = new ArrayList<>();
        try {
            for (String key : new TreeSet<>(keys)) {
                RLock lock = redissonClient.getLock(key);
                boolean acquired = lock.tryLock(properties.getWaitTimeMs(), properties.getLeaseTimeMs(),
                        TimeUnit.MILLISECONDS);
                if (!acquired) {
                    releaseLocks(acquiredLocks);
                    throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED,
                            "Failed to acquire lock: " + key);
                }
                acquiredLocks.add(lock);
            }
            return acquiredLocks;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseLocks(acquiredLocks);
            throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED,
                    "Lock acquisition interrupted");
        }
    }

    @SuppressWarnings("unused")
    private List<RLock> acquireLocksFallback(Collection<String> keys, Throwable t) {
        if (t instanceof BusinessException businessException) {
            throw businessException;
        }
        log.error("Redis circuit breaker open. Lock unavailable for keys: {}", keys, t);
        throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED,
                "Service temporarily unavailable. Please try again shortly.");
    }

    @Override
    public void releaseLocks(List<RLock> locks) {
        for (RLock lock : locks) {
            try {
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                }
            } catch (Exception e) {
                log.warn("Failed to release lock: {}", lock.getName(), e);
            }
        }
    }
}
