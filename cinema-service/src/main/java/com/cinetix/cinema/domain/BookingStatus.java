package com.cinetix.cinema.domain;

import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;

public enum BookingStatus {
    ACTIVE,
    CANCELLED,
    EXPIRED;

    public boolean holdsSlot() {
        return this == ACTIVE;
    }

    /**
     * Returns the status after moving to {@code target}. Repeating a terminal transition is a no-op;
     * the two terminal states never convert into each other and nothing returns to ACTIVE.
     */
    public BookingStatus transitionTo(BookingStatus target) {
        if (this == target || this == ACTIVE) {
            return target;
        }
        throw new BusinessException(ErrorCode.BOOKING_NOT_ACTIVE,
                "Cannot move booking from " + this + " to " + target);
    }
}
