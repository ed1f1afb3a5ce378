package com.cinetix.cinema.dto.response;

import com.cinetix.cinema.domain.Payment;
import com.cinetix.cinema.domain.PaymentMethod;
import com.cinetix.cinema.domain.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PaymentResponse(
        Long id,
        Long bookingId,
        Long accountId,
        BigDecimal amount,
        PaymentMethod method,
        PaymentStatus status,
        LocalDateTime recordedAt,
        String reference,
        BookingResponse booking,
        AccountResponse account
) {
    public static PaymentResponse of(Payment payment, BookingResponse booking, AccountResponse account) {
        return new PaymentResponse(
                payment.getId(),
                payment.getBookingId(),
                payment.getAccountId(),
                payment.getAmount(),
                payment.getMethod(),
                payment.getStatus(),
                payment.getRecordedAt(),
                payment.getReference(),
                booking,
                account
        );
    }
}
