package com.cinetix.cinema.dto.response;

import com.cinetix.cinema.domain.Schedule;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record ScheduleResponse(
        Long id,
        Long auditoriumId,
        Long filmId,
        LocalDateTime showTime,
        BigDecimal price,
        AuditoriumResponse auditorium,
        FilmResponse film
) {
    public static ScheduleResponse of(Schedule schedule, AuditoriumResponse auditorium, FilmResponse film) {
        return new ScheduleResponse(
                schedule.getId(),
                schedule.getAuditoriumId(),
                schedule.getFilmId(),
                schedule.getShowTime(),
                schedule.getPrice(),
                auditorium,
                film
        );
    }
}
