package com.cinetix.cinema.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ReserveSeatRequest(
        @NotNull Long scheduleId,
        @NotNull Long accountId,
        @NotBlank @Size(max = 10) String seatCode
) {
}
