package com.cinetix.cinema.service;

import com.cinetix.cinema.TestFixtures;
import com.cinetix.cinema.domain.Booking;
import com.cinetix.cinema.domain.BookingStatus;
import com.cinetix.cinema.jooq.BookingJooqRepository;
import com.cinetix.cinema.jooq.ScheduleJooqRepository;
import com.cinetix.cinema.repository.BookingRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingTransactionServiceTest {

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingJooqRepository bookingJooqRepository;
    @Mock
    private ScheduleJooqRepository scheduleJooqRepository;
    @Mock
    private ConsistencyGuard consistencyGuard;
    @Mock
    private SnapshotAssembler snapshotAssembler;

    private BookingTransactionService transactionService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TestFixtures.NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        transactionService = new BookingTransactionService(bookingRepository, bookingJooqRepository,
                scheduleJooqRepository, consistencyGuard, snapshotAssembler, clock);
    }

    @SuppressWarnings("unchecked")
    private void passThroughCommit() {
        when(consistencyGuard.commitUnique(any(Supplier.class), any(ErrorCode.class), anyString()))
                .thenAnswer(inv -> ((Supplier<Object>) inv.getArgument(0)).get());
    }

    @Test
    void reserveInTransaction_freeSeat_createsActiveBookingWithServerTime() {
        when(scheduleJooqRepository.lockForUpdate(10L)).thenReturn(true);
        when(consistencyGuard.seatFree(10L, "A1", null)).thenReturn(true);
        passThroughCommit();
        when(bookingRepository.saveAndFlush(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));

        transactionService.reserveInTransaction(10L, 100L, "A1");

        ArgumentCaptor<Booking> captor = ArgumentCaptor.forClass(Booking.class);
        verify(bookingRepository).saveAndFlush(captor.capture());
        Booking saved = captor.getValue();
        assertThat(saved.getStatus()).isEqualTo(BookingStatus.ACTIVE);
        assertThat(saved.getBookedAt()).isEqualTo(TestFixtures.NOW);
        assertThat(saved.getActiveSlot()).isEqualTo("10/A1");
        verify(consistencyGuard).requireReference(EntityKind.ACCOUNT, 100L);
        verify(snapshotAssembler).booking(saved);
    }

    @Test
    void reserveInTransaction_seatTaken_throwsWithoutWriting() {
        when(scheduleJooqRepository.lockForUpdate(10L)).thenReturn(true);
        when(consistencyGuard.seatFree(10L, "A1", null)).thenReturn(false);

        assertThatThrownBy(() -> transactionService.reserveInTransaction(10L, 100L, "A1"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.SEAT_TAKEN);
        verify(bookingRepository, never()).saveAndFlush(any());
    }

    @Test
    void reserveInTransaction_unknownSchedule_throwsReferenceNotFound() {
        when(scheduleJooqRepository.lockForUpdate(10L)).thenReturn(false);

        assertThatThrownBy(() -> transactionService.reserveInTransaction(10L, 100L, "A1"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.REFERENCE_NOT_FOUND);
        verify(bookingRepository, never()).saveAndFlush(any());
    }

    @Test
    void reserveInTransaction_unknownAccount_throwsReferenceNotFound() {
        when(scheduleJooqRepository.lockForUpdate(10L)).thenReturn(true);
        doThrow(new BusinessException(ErrorCode.REFERENCE_NOT_FOUND))
                .when(consistencyGuard).requireReference(EntityKind.ACCOUNT, 100L);

        assertThatThrownBy(() -> transactionService.reserveInTransaction(10L, 100L, "A1"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.REFERENCE_NOT_FOUND);
        verify(bookingRepository, never()).saveAndFlush(any());
    }

    @Test
    void changeSeatInTransaction_excludesOwnBookingFromConflictScan() {
        Booking booking = TestFixtures.booking(1L, 10L, 100L, "A1");
        when(bookingJooqRepository.findStatusForUpdate(1L)).thenReturn(Optional.of("ACTIVE"));
        when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));
        when(scheduleJooqRepository.lockForUpdate(10L)).thenReturn(true);
        when(consistencyGuard.seatFree(10L, "A2", 1L)).thenReturn(true);
        passThroughCommit();
        when(bookingRepository.saveAndFlush(booking)).thenReturn(booking);

        transactionService.changeSeatInTransaction(1L, 10L, "A2");

        assertThat(booking.getSeatCode()).isEqualTo("A2");
        assertThat(booking.getActiveSlot()).isEqualTo("10/A2");
        verify(consistencyGuard).seatFree(10L, "A2", 1L);
    }

    @Test
    void changeSeatInTransaction_targetTaken_leavesBookingUnchanged() {
        Booking booking = TestFixtures.booking(1L, 10L, 100L, "A1");
        when(bookingJooqRepository.findStatusForUpdate(1L)).thenReturn(Optional.of("ACTIVE"));
        when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));
        when(scheduleJooqRepository.lockForUpdate(11L)).thenReturn(true);
        when(consistencyGuard.seatFree(11L, "B1", 1L)).thenReturn(false);

        assertThatThrownBy(() -> transactionService.changeSeatInTransaction(1L, 11L, "B1"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.SEAT_TAKEN);
        assertThat(booking.getScheduleId()).isEqualTo(10L);
        assertThat(booking.getSeatCode()).isEqualTo("A1");
    }

    @Test
    void changeSeatInTransaction_unknownBooking_throwsBookingNotFound() {
        when(bookingJooqRepository.findStatusForUpdate(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> transactionService.changeSeatInTransaction(1L, 10L, "A2"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.BOOKING_NOT_FOUND);
    }

    @Test
    void changeSeatInTransaction_cancelledBooking_throwsBookingNotActive() {
        Booking booking = TestFixtures.booking(1L, 10L, 100L, "A1");
        booking.cancel();
        when(bookingJooqRepository.findStatusForUpdate(1L)).thenReturn(Optional.of("CANCELLED"));
        when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> transactionService.changeSeatInTransaction(1L, 10L, "A2"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.BOOKING_NOT_ACTIVE);
        verify(scheduleJooqRepository, never()).lockForUpdate(any());
    }

    @Test
    void cancelInTransaction_twice_writesOnce() {
        Booking booking = TestFixtures.booking(1L, 10L, 100L, "A1");
        when(bookingJooqRepository.findStatusForUpdate(1L)).thenReturn(Optional.of("ACTIVE"));
        when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));

        transactionService.cancelInTransaction(1L);
        transactionService.cancelInTransaction(1L);

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        verify(bookingRepository, times(1)).saveAndFlush(booking);
        verify(snapshotAssembler, times(2)).booking(booking);
    }

    @Test
    void expireInTransaction_cancelledBooking_throwsBookingNotActive() {
        Booking booking = TestFixtures.booking(1L, 10L, 100L, "A1");
        booking.cancel();
        when(bookingJooqRepository.findStatusForUpdate(1L)).thenReturn(Optional.of("CANCELLED"));
        when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> transactionService.expireInTransaction(1L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.BOOKING_NOT_ACTIVE);
        verify(bookingRepository, never()).saveAndFlush(any());
    }
}
