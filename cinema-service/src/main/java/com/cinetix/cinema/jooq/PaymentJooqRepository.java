package com.cinetix.cinema.jooq;

import lombok.RequiredArgsConstructor;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PaymentJooqRepository {

    public static final String SUCCESS = "SUCCESS";

    static final Table<?> PAYMENTS = DSL.table("payments");
    static final Field<Long> ID = DSL.field("id", Long.class);
    static final Field<Long> BOOKING_ID = DSL.field("booking_id", Long.class);
    static final Field<String> STATUS = DSL.field("status", String.class);

    private final DSLContext dsl;

    /**
     * True if a SUCCESS payment other than {@code excludePaymentId} exists for the booking.
     */
    public boolean existsSettled(Long bookingId, Long excludePaymentId) {
        Condition condition = BOOKING_ID.eq(bookingId).and(STATUS.eq(SUCCESS));
        if (excludePaymentId != null) {
            condition = condition.and(ID.ne(excludePaymentId));
        }
        return dsl.fetchExists(dsl.selectOne().from(PAYMENTS).where(condition));
    }
}
