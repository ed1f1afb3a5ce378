package com.cinetix.cinema.service;

import com.cinetix.cinema.jooq.BookingJooqRepository;
import com.cinetix.cinema.jooq.PaymentJooqRepository;
import com.cinetix.cinema.repository.*;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Existence and uniqueness predicates shared by the schedule, booking and payment services,
 * plus the check-and-write primitive both ledgers commit through.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsistencyGuard {

    private final FilmRepository filmRepository;
    private final AuditoriumRepository auditoriumRepository;
    private final ScheduleRepository scheduleRepository;
    private final AccountRepository accountRepository;
    private final BookingRepository bookingRepository;
    private final PaymentRepository paymentRepository;
    private final BookingJooqRepository bookingJooqRepository;
    private final PaymentJooqRepository paymentJooqRepository;

    public boolean exists(EntityKind kind, Long id) {
        if (id == null) {
            return false;
        }
        return switch (kind) {
            case FILM -> filmRepository.existsById(id);
            case AUDITORIUM -> auditoriumRepository.existsById(id);
            case SCHEDULE -> scheduleRepository.existsById(id);
            case ACCOUNT -> accountRepository.existsById(id);
            case BOOKING -> bookingRepository.existsById(id);
            case PAYMENT -> paymentRepository.existsById(id);
        };
    }

    public void requireReference(EntityKind kind, Long id) {
        if (!exists(kind, id)) {
            throw new BusinessException(ErrorCode.REFERENCE_NOT_FOUND,
                    "Referenced " + kind.name().toLowerCase() + " not found: " + id);
        }
    }

    public boolean seatFree(Long scheduleId, String seatCode, Long excludeBookingId) {
        return !bookingJooqRepository.existsActiveInSlot(scheduleId, seatCode, excludeBookingId);
    }

    public boolean noSuccessfulPayment(Long bookingId, Long excludePaymentId) {
        return !paymentJooqRepository.existsSettled(bookingId, excludePaymentId);
    }

    /**
     * Runs a flushing write and turns a unique-key violation into {@code errorCode}.
     * The caller's transaction is marked for rollback either way, so nothing of the losing write survives.
     */
    public <T> T commitUnique(Supplier<T> write, ErrorCode errorCode, String message) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException e) {
            log.warn("Unique constraint rejected write: code={}, reason={}",
                    errorCode.getCode(), e.getMostSpecificCause().getMessage());
            throw new BusinessException(errorCode, message);
        }
    }
}
