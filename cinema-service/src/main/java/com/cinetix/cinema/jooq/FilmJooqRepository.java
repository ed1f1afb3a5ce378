package com.cinetix.cinema.jooq;

import lombok.RequiredArgsConstructor;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Repository;

/**
 * Row lock on a film. Taken by film deletion and by schedule create/update referencing the film,
 * so a schedule can never commit against a film that is being deleted.
 * Must be called within an active transaction.
 */
@Repository
@RequiredArgsConstructor
public class FilmJooqRepository {

    static final Table<?> FILMS = DSL.table("films");
    static final Field<Long> ID = DSL.field("id", Long.class);

    private final DSLContext dsl;

    /**
     * Select the film row FOR UPDATE.
     * Returns false if the film does not exist.
     */
    public boolean lockForUpdate(Long filmId) {
        return dsl.select(ID)
                .from(FILMS)
                .where(ID.eq(filmId))
                .forUpdate()
                .fetchOptional()
                .isPresent();
    }
}
