package com.cinetix.cinema.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AuditoriumRequest(
        @NotBlank @Size(max = 100) String name,
        @Min(1) @Max(1000) int capacity,
        @Size(max = 500) String facilities
) {
}
