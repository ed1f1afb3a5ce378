package com.cinetix.cinema.jooq;

import lombok.RequiredArgsConstructor;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * jOOQ repository for the booking hot path: slot occupancy checks and booking row locks.
 * Locking methods MUST be called within an active transaction.
 */
@Repository
@RequiredArgsConstructor
public class BookingJooqRepository {

    public static final String ACTIVE = "ACTIVE";

    static final Table<?> BOOKINGS = DSL.table("bookings");
    static final Field<Long> ID = DSL.field("id", Long.class);
    static final Field<Long> SCHEDULE_ID = DSL.field("schedule_id", Long.class);
    static final Field<String> SEAT_CODE = DSL.field("seat_code", String.class);
    static final Field<String> STATUS = DSL.field("status", String.class);

    private final DSLContext dsl;

    /**
     * True if an ACTIVE booking other than {@code excludeBookingId} occupies the slot.
     */
    public boolean existsActiveInSlot(Long scheduleId, String seatCode, Long excludeBookingId) {
        Condition condition = SCHEDULE_ID.eq(scheduleId)
                .and(SEAT_CODE.eq(seatCode))
                .and(STATUS.eq(ACTIVE));
        if (excludeBookingId != null) {
            condition = condition.and(ID.ne(excludeBookingId));
        }
        return dsl.fetchExists(dsl.selectOne().from(BOOKINGS).where(condition));
    }

    /**
     * Select the booking's status with FOR UPDATE lock.
     * Returns empty if the booking does not exist.
     */
    public Optional<String> findStatusForUpdate(Long bookingId) {
        return dsl.select(STATUS)
                .from(BOOKINGS)
                .where(ID.eq(bookingId))
                .forUpdate()
                .fetchOptional(STATUS);
    }
}
