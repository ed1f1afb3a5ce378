package com.cinetix.cinema.dto.response;

import com.cinetix.cinema.domain.Booking;
import com.cinetix.cinema.domain.BookingStatus;

import java.time.LocalDateTime;

public record BookingResponse(
        Long id,
        Long scheduleId,
        Long accountId,
        String seatCode,
        BookingStatus status,
        LocalDateTime bookedAt,
        ScheduleResponse schedule,
        AccountResponse account
) {
    public static BookingResponse of(Booking booking, ScheduleResponse schedule, AccountResponse account) {
        return new BookingResponse(
                booking.getId(),
                booking.getScheduleId(),
                booking.getAccountId(),
                booking.getSeatCode(),
                booking.getStatus(),
                booking.getBookedAt(),
                schedule,
                account
        );
    }
}
