package com.cinetix.cinema.service;

import org.redisson.api.RLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Used when {@code cinema.slot-lock.enabled=false}: single-instance deployments and tests without Redis.
 */
@Component
@ConditionalOnProperty(prefix = "cinema.slot-lock", name = "enabled", havingValue = "false")
public class NoOpSlotLockService implements SlotLockService {

    @Override
    public List<RLock> acquireLocks(Collection<String> keys) {
        return List.of();
    }

    @Override
    public void releaseLocks(List<RLock> locks) {
    }
}
