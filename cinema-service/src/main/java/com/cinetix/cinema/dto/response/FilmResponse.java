package com.cinetix.cinema.dto.response;

import com.cinetix.cinema.domain.Film;

public record FilmResponse(
        Long id,
        String title,
        String genre,
        int durationMinutes,
        String description
) {
    public static FilmResponse from(Film film) {
        return new FilmResponse(
                film.getId(),
                film.getTitle(),
                film.getGenre(),
                film.getDurationMinutes(),
                film.getDescription()
        );
    }
}
