package com.cinetix.cinema.dto.request;

import com.cinetix.cinema.domain.PaymentMethod;
import com.cinetix.cinema.domain.PaymentStatus;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record PaymentRequest(
        @NotNull Long bookingId,
        @NotNull Long accountId,
        @NotNull @DecimalMax("10000000") @Digits(integer = 10, fraction = 2) BigDecimal amount,
        @NotNull PaymentMethod method,
        @NotNull PaymentStatus status,
        @Size(max = 100) String reference
) {
}
