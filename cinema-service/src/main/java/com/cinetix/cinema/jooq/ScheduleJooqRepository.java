package com.cinetix.cinema.jooq;

import lombok.RequiredArgsConstructor;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Repository;

/**
 * Row lock on a schedule. Reservations, seat changes and schedule deletion all take it,
 * which serialises every slot check of one schedule. Must be called within an active transaction.
 */
@Repository
@RequiredArgsConstructor
public class ScheduleJooqRepository {

    static final Table<?> SCHEDULES = DSL.table("schedules");
    static final Field<Long> ID = DSL.field("id", Long.class);

    private final DSLContext dsl;

    /**
     * Select the schedule row FOR UPDATE.
     * Returns false if the schedule does not exist.
     */
    public boolean lockForUpdate(Long scheduleId) {
        return dsl.select(ID)
                .from(SCHEDULES)
                .where(ID.eq(scheduleId))
                .forUpdate()
                .fetchOptional()
                .isPresent();
    }
}
