package com.cinetix.cinema.service;

import com.cinetix.cinema.domain.Booking;
import com.cinetix.cinema.dto.response.BookingResponse;
import com.cinetix.cinema.repository.BookingRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final BookingRepository bookingRepository;
    private final BookingTransactionService bookingTransactionService;
    private final SlotLockService slotLockService;
    private final ConsistencyGuard consistencyGuard;
    private final SnapshotAssembler snapshotAssembler;

    /**
     * Reserve a seat with 3-tier protection:
     * 1. Distributed slot lock (cross-instance)
     * 2. Schedule row lock (FOR UPDATE)
     * 3. Unique active-slot key
     */
    public BookingResponse reserve(Long scheduleId, Long accountId, String seatCode) {
        log.info("Reserve seat: scheduleId={}, accountId={}, seatCode={}", scheduleId, accountId, seatCode);

        // Tier 1: distributed lock
        List<RLock> locks = slotLockService.acquireLocks(List.of(SlotLockService.slotKey(scheduleId, seatCode)));
        try {
            return bookingTransactionService.reserveInTransaction(scheduleId, accountId, seatCode);
        } finally {
            slotLockService.releaseLocks(locks);
        }
    }

    /**
     * Moves an active booking to another slot in place. Its own current slot never counts as a conflict.
     */
    public BookingResponse changeSeat(Long bookingId, Long newScheduleId, String newSeatCode) {
        log.info("Change seat: bookingId={}, scheduleId={}, seatCode={}", bookingId, newScheduleId, newSeatCode);

        List<RLock> locks = slotLockService.acquireLocks(
                List.of(SlotLockService.slotKey(newScheduleId, newSeatCode)));
        try {
            return bookingTransactionService.changeSeatInTransaction(bookingId, newScheduleId, newSeatCode);
        } finally {
            slotLockService.releaseLocks(locks);
        }
    }

    public BookingResponse cancel(Long bookingId) {
        log.info("Cancelling booking: bookingId={}", bookingId);
        return bookingTransactionService.cancelInTransaction(bookingId);
    }

    public BookingResponse expire(Long bookingId) {
        log.info("Expiring booking: bookingId={}", bookingId);
        return bookingTransactionService.expireInTransaction(bookingId);
    }

    @Transactional(readOnly = true)
    public BookingResponse getBooking(Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        return snapshotAssembler.booking(booking);
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getBookings() {
        return snapshotAssembler.bookings(bookingRepository.findAllByOrderByBookedAtDescIdDesc());
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getAccountBookings(Long accountId) {
        if (!consistencyGuard.exists(EntityKind.ACCOUNT, accountId)) {
            throw new BusinessException(ErrorCode.ACCOUNT_NOT_FOUND,
                    "Account not found: " + accountId);
        }
        return snapshotAssembler.bookings(bookingRepository.findByAccountIdOrderByBookedAtDescIdDesc(accountId));
    }
}
