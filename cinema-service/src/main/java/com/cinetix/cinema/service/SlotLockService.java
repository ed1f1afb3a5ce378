package com.cinetix.cinema.service;

import org.redisson.api.RLock;

import java.util.Collection;
import java.util.List;

/**
 * Tier 1: cross-instance lock around reservations and payments.
 * It only reduces contention; row locks and unique keys still decide every conflict.
 */
public interface SlotLockService {

    String SLOT_PREFIX = "lock:slot:";
    String PAYMENT_PREFIX = "lock:payment:";

    static String slotKey(Long scheduleId, String seatCode) {
        return SLOT_PREFIX + scheduleId + "/" + seatCode;
    }

    static String paymentKey(Long bookingId) {
        return PAYMENT_PREFIX + bookingId;
    }

    /**
     * Acquires every key in sorted order and returns the held locks for {@link #releaseLocks}.
     */
    List<RLock> acquireLocks(Collection<String> keys);

    void releaseLocks(List<RLock> locks);
}
