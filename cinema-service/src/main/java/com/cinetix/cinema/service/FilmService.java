package com.cinetix.cinema.service;

import com.cinetix.cinema.domain.Film;
import com.cinetix.cinema.dto.request.FilmRequest;
import com.cinetix.cinema.dto.response.FilmResponse;
import com.cinetix.cinema.jooq.FilmJooqRepository;
import com.cinetix.cinema.repository.FilmRepository;
import com.cinetix.cinema.repository.ScheduleRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FilmService {

    private final FilmRepository filmRepository;
    private final FilmJooqRepository filmJooqRepository;
    private final ScheduleRepository scheduleRepository;

    @Transactional
    public FilmResponse createFilm(FilmRequest request) {
        Film film = filmRepository.save(Film.builder()
                .title(request.title())
                .genre(request.genre())
                .durationMinutes(request.durationMinutes())
                .description(request.description())
                .build());

        log.info("Created film id={}, title={}", film.getId(), film.getTitle());
        return FilmResponse.from(film);
    }

    @Transactional
    public FilmResponse updateFilm(Long filmId, FilmRequest request) {
        Film film = findFilm(filmId);
        film.update(request.title(), request.genre(), request.durationMinutes(), request.description());

        log.info("Updated film id={}", filmId);
        return FilmResponse.from(film);
    }

    @Transactional(readOnly = true)
    public FilmResponse getFilm(Long filmId) {
        return FilmResponse.from(findFilm(filmId));
    }

    @Transactional(readOnly = true)
    public List<FilmResponse> getFilms() {
        return filmRepository.findAllByOrderByTitleAsc().stream()
                .map(FilmResponse::from)
                .toList();
    }

    /**
     * Schedule create/update lock the same film row, so no schedule can reference the film
     * between the check and the delete.
     */
    @Transactional
    public void deleteFilm(Long filmId) {
        if (!filmJooqRepository.lockForUpdate(filmId)) {
            throw new BusinessException(ErrorCode.FILM_NOT_FOUND,
                    "Film not found: " + filmId);
        }
        if (scheduleRepository.existsByFilmId(filmId)) {
            throw new BusinessException(ErrorCode.RESOURCE_IN_USE,
                    "Film is still scheduled: " + filmId);
        }
        filmRepository.deleteById(filmId);
        log.info("Deleted film id={}", filmId);
    }

    private Film findFilm(Long filmId) {
        return filmRepository.findById(filmId)
                .orElseThrow(() -> new BusinessException(ErrorCode.FILM_NOT_FOUND,
                        "Film not found: " + filmId));
    }
}
