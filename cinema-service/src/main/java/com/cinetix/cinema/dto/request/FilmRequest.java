package com.cinetix.cinema.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record FilmRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 50) String genre,
        @Min(1) @Max(600) int durationMinutes,
        @Size(max = 1000) String description
) {
}
