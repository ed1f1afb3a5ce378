package com.cinetix.cinema.jooq;

import lombok.RequiredArgsConstructor;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Repository;

/**
 * Row lock on an auditorium, shared by auditorium deletion and schedule create/update.
 * Must be called within an active transaction.
 */
@Repository
@RequiredArgsConstructor
public class AuditoriumJooqRepository {

    static final Table<?> AUDITORIUMS = DSL.table("auditoriums");
    static final Field<Long> ID = DSL.field("id", Long.class);

    private final DSLContext dsl;

    public boolean lockForUpdate(Long auditoriumId) {
        return dsl.select(ID)
                .from(AUDITORIUMS)
                .where(ID.eq(auditoriumId))
                .forUpdate()
                .fetchOptional()
                .isPresent();
    }
}
