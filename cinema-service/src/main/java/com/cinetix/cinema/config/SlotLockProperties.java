package com.cinetix.cinema.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "cinema.slot-lock")
public class SlotLockProperties {

    /**
     * When false, reservations and payments rely on row locks and unique constraints only.
     */
    private boolean enabled = true;

    /**
     * A caller still waiting after this long fails with LOCK_ACQUISITION_FAILED, not SEAT_TAKEN,
     * since it never got to inspect the seat.
     */
    private long waitTimeMs = 3000;
    private long leaseTimeMs = 5000;
}
