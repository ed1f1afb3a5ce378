package com.cinetix.cinema.service;

import com.cinetix.cinema.domain.Booking;
import com.cinetix.cinema.dto.response.BookingResponse;
import com.cinetix.cinema.jooq.BookingJooqRepository;
import com.cinetix.cinema.jooq.ScheduleJooqRepository;
import com.cinetix.cinema.repository.BookingRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Separated from BookingService to ensure @Transactional works
 * (avoids Spring AOP self-invocation bypass).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingTransactionService {

    private final BookingRepository bookingRepository;
    private final BookingJooqRepository bookingJooqRepository;
    private final ScheduleJooqRepository scheduleJooqRepository;
    private final ConsistencyGuard consistencyGuard;
    private final SnapshotAssembler snapshotAssembler;
    private final Clock clock;

    /**
     * Tier 2 & 3: schedule row lock + unique active slot within one transaction.
     */
    @Transactional
    public BookingResponse reserveInTransaction(Long scheduleId, Long accountId, String seatCode) {
        // Tier 2: every slot check for this schedule queues behind this lock
        if (!scheduleJooqRepository.lockForUpdate(scheduleId)) {
            throw new BusinessException(ErrorCode.REFERENCE_NOT_FOUND,
                    "Referenced schedule not found: " + scheduleId);
        }
        consistencyGuard.requireReference(EntityKind.ACCOUNT, accountId);

        if (!consistencyGuard.seatFree(scheduleId, seatCode, null)) {
            throw seatTaken(scheduleId, seatCode);
        }

        Booking booking = Booking.builder()
                .scheduleId(scheduleId)
                .accountId(accountId)
                .seatCode(seatCode)
                .bookedAt(LocalDateTime.now(clock))
                .build();

        // Tier 3: uk_bookings_active_slot
        Booking saved = consistencyGuard.commitUnique(
                () -> bookingRepository.saveAndFlush(booking),
                ErrorCode.SEAT_TAKEN, seatTakenMessage(scheduleId, seatCode));

        log.info("Seat reserved: bookingId={}, scheduleId={}, seatCode={}, accountId={}",
                saved.getId(), scheduleId, seatCode, accountId);
        return snapshotAssembler.booking(saved);
    }

    @Transactional
    public BookingResponse changeSeatInTransaction(Long bookingId, Long newScheduleId, String newSeatCode) {
        lockBooking(bookingId);
        Booking booking = findBooking(bookingId);
        if (!booking.isActive()) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_ACTIVE,
                    "Booking is not active: bookingId=" + bookingId + ", status=" + booking.getStatus());
        }

        if (!scheduleJooqRepository.lockForUpdate(newScheduleId)) {
            throw new BusinessException(ErrorCode.REFERENCE_NOT_FOUND,
                    "Referenced schedule not found: " + newScheduleId);
        }
        if (!consistencyGuard.seatFree(newScheduleId, newSeatCode, bookingId)) {
            throw seatTaken(newScheduleId, newSeatCode);
        }

        booking.moveTo(newScheduleId, newSeatCode);
        Booking saved = consistencyGuard.commitUnique(
                () -> bookingRepository.saveAndFlush(booking),
                ErrorCode.SEAT_TAKEN, seatTakenMessage(newScheduleId, newSeatCode));

        log.info("Seat changed: bookingId={}, scheduleId={}, seatCode={}",
                bookingId, newScheduleId, newSeatCode);
        return snapshotAssembler.booking(saved);
    }

    @Transactional
    public BookingResponse cancelInTransaction(Long bookingId) {
        lockBooking(bookingId);
        Booking booking = findBooking(bookingId);

        if (booking.cancel()) {
            bookingRepository.saveAndFlush(booking);
            log.info("Booking cancelled: bookingId={}", bookingId);
        }
        return snapshotAssembler.booking(booking);
    }

    @Transactional
    public BookingResponse expireInTransaction(Long bookingId) {
        lockBooking(bookingId);
        Booking booking = findBooking(bookingId);

        if (booking.expire()) {
            bookingRepository.saveAndFlush(booking);
            log.info("Booking expired: bookingId={}", bookingId);
        }
        return snapshotAssembler.booking(booking);
    }

    private void lockBooking(Long bookingId) {
        if (bookingJooqRepository.findStatusForUpdate(bookingId).isEmpty()) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                    "Booking not found: " + bookingId);
        }
    }

    private Booking findBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
    }

    private static BusinessException seatTaken(Long scheduleId, String seatCode) {
        return new BusinessException(ErrorCode.SEAT_TAKEN, seatTakenMessage(scheduleId, seatCode));
    }

    private static String seatTakenMessage(Long scheduleId, String seatCode) {
        return "Seat " + seatCode + " is already booked for schedule " + scheduleId;
    }
}
