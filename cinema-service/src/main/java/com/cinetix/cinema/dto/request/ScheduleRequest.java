package com.cinetix.cinema.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Show time and price positivity and scale are checked by the service against the server clock.
 */
public record ScheduleRequest(
        @NotNull Long auditoriumId,
        @NotNull Long filmId,
        @NotNull LocalDateTime showTime,
        @NotNull @DecimalMax("1000000") @Digits(integer = 10, fraction = 2) BigDecimal price
) {
}
