package com.cinetix.cinema.service;

import com.cinetix.cinema.TestFixtures;
import com.cinetix.cinema.domain.Booking;
import com.cinetix.cinema.domain.BookingStatus;
import com.cinetix.cinema.dto.response.BookingResponse;
import com.cinetix.cinema.repository.BookingRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingTransactionService bookingTransactionService;
    @Mock
    private SlotLockService slotLockService;
    @Mock
    private ConsistencyGuard consistencyGuard;
    @Mock
    private SnapshotAssembler snapshotAssembler;

    @InjectMocks
    private BookingService bookingService;

    @Test
    void reserve_locksSlotAndReleasesAfterCommit() {
        List<RLock> locks = List.of(mock(RLock.class));
        BookingResponse response = new BookingResponse(1L, 10L, 100L, "A1", BookingStatus.ACTIVE,
                TestFixtures.NOW, null, null);
        when(slotLockService.acquireLocks(List.of("lock:slot:10/A1"))).thenReturn(locks);
        when(bookingTransactionService.reserveInTransaction(10L, 100L, "A1")).thenReturn(response);

        BookingResponse result = bookingService.reserve(10L, 100L, "A1");

        assertThat(result).isSameAs(response);
        verify(slotLockService).releaseLocks(locks);
    }

    @Test
    void reserve_seatTaken_stillReleasesLocks() {
        List<RLock> locks = List.of(mock(RLock.class));
        when(slotLockService.acquireLocks(List.of("lock:slot:10/A1"))).thenReturn(locks);
        when(bookingTransactionService.reserveInTransaction(10L, 100L, "A1"))
                .thenThrow(new BusinessException(ErrorCode.SEAT_TAKEN));

        assertThatThrownBy(() -> bookingService.reserve(10L, 100L, "A1"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.SEAT_TAKEN);
        verify(slotLockService).releaseLocks(locks);
    }

    @Test
    void reserve_lockUnavailable_neverOpensTransaction() {
        when(slotLockService.acquireLocks(List.of("lock:slot:10/A1")))
                .thenThrow(new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED));

        assertThatThrownBy(() -> bookingService.reserve(10L, 100L, "A1"))
                .isInstanceOf(BusinessException.class);
        verifyNoInteractions(bookingTransactionService);
    }

    @Test
    void changeSeat_locksTargetSlot() {
        when(slotLockService.acquireLocks(List.of("lock:slot:11/B2"))).thenReturn(List.of());

        bookingService.changeSeat(1L, 11L, "B2");

        verify(bookingTransactionService).changeSeatInTransaction(1L, 11L, "B2");
        verify(slotLockService).releaseLocks(List.of());
    }

    @Test
    void getBooking_notFound_throwsBookingNotFound() {
        when(bookingRepository.findById(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookingService.getBooking(1L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.BOOKING_NOT_FOUND);
    }

    @Test
    void getAccountBookings_unknownAccount_throwsAccountNotFound() {
        when(consistencyGuard.exists(EntityKind.ACCOUNT, 100L)).thenReturn(false);

        assertThatThrownBy(() -> bookingService.getAccountBookings(100L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ACCOUNT_NOT_FOUND);
        verify(bookingRepository, never()).findByAccountIdOrderByBookedAtDescIdDesc(any());
    }

    @Test
    void getAccountBookings_assemblesSnapshotsInRepositoryOrder() {
        Booking newer = TestFixtures.booking(2L, 10L, 100L, "A2");
        Booking older = TestFixtures.booking(1L, 10L, 100L, "A1");
        when(consistencyGuard.exists(EntityKind.ACCOUNT, 100L)).thenReturn(true);
        when(bookingRepository.findByAccountIdOrderByBookedAtDescIdDesc(100L)).thenReturn(List.of(newer, older));

        bookingService.getAccountBookings(100L);

        verify(snapshotAssembler).bookings(List.of(newer, older));
    }
}
