package com.cinetix.cinema.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ChangeSeatRequest(
        @NotNull Long scheduleId,
        @NotBlank @Size(max = 10) String seatCode
) {
}
