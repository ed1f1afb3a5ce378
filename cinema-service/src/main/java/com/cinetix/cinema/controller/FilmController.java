package com.cinetix.cinema.controller;

import com.cinetix.cinema.dto.request.FilmRequest;
import com.cinetix.cinema.dto.response.FilmResponse;
import com.cinetix.cinema.service.FilmService;
import com.cinetix.common.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Film", description = "Film catalog")
@RestController
@RequestMapping("/api/v1/films")
@RequiredArgsConstructor
public class FilmController {

    private final FilmService filmService;

    @Operation(summary = "Create film")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Film created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<FilmResponse>> createFilm(@Valid @RequestBody FilmRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(filmService.createFilm(request)));
    }

    @Operation(summary = "Update film", description = "Replace all film fields")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Film updated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Film not found")
    })
    @PutMapping("/{filmId}")
    public ResponseEntity<ApiResponse<FilmResponse>> updateFilm(
            @PathVariable Long filmId,
            @Valid @RequestBody FilmRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(filmService.updateFilm(filmId, request)));
    }

    @Operation(summary = "Get film")
    @GetMapping("/{filmId}")
    public ResponseEntity<ApiResponse<FilmResponse>> getFilm(@PathVariable Long filmId) {
        return ResponseEntity.ok(ApiResponse.ok(filmService.getFilm(filmId)));
    }

    @Operation(summary = "List films")
    @GetMapping
    public ResponseEntity<ApiResponse<List<FilmResponse>>> getFilms() {
        return ResponseEntity.ok(ApiResponse.ok(filmService.getFilms()));
    }

    @Operation(summary = "Delete film", description = "Rejected while any schedule references the film")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Film deleted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Film not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Film still scheduled")
    })
    @DeleteMapping("/{filmId}")
    public ResponseEntity<ApiResponse<Void>> deleteFilm(@PathVariable Long filmId) {
        filmService.deleteFilm(filmId);
        return ResponseEntity.ok(ApiResponse.ok());
    }
}
