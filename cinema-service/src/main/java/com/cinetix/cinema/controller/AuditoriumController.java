package com.cinetix.cinema.controller;

import com.cinetix.cinema.dto.request.AuditoriumRequest;
import com.cinetix.cinema.dto.response.AuditoriumResponse;
import com.cinetix.cinema.service.AuditoriumService;
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

@Tag(name = "Auditorium", description = "Auditorium management")
@RestController
@RequestMapping("/api/v1/auditoriums")
@RequiredArgsConstructor
public class AuditoriumController {

    private final AuditoriumService auditoriumService;

    @Operation(summary = "Create auditorium")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Auditorium created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<AuditoriumResponse>> createAuditorium(
            @Valid @RequestBody AuditoriumRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(auditoriumService.createAuditorium(request)));
    }

    @Operation(summary = "Update auditorium")
    @PutMapping("/{auditoriumId}")
    public ResponseEntity<ApiResponse<AuditoriumResponse>> updateAuditorium(
            @PathVariable Long auditoriumId,
            @Valid @RequestBody AuditoriumRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(auditoriumService.updateAuditorium(auditoriumId, request)));
    }

    @Operation(summary = "Get auditorium")
    @GetMapping("/{auditoriumId}")
    public ResponseEntity<ApiResponse<AuditoriumResponse>> getAuditorium(@PathVariable Long auditoriumId) {
        return ResponseEntity.ok(ApiResponse.ok(auditoriumService.getAuditorium(auditoriumId)));
    }

    @Operation(summary = "List auditoriums")
    @GetMapping
    public ResponseEntity<ApiResponse<List<AuditoriumResponse>>> getAuditoriums() {
        return ResponseEntity.ok(ApiResponse.ok(auditoriumService.getAuditoriums()));
    }

    @Operation(summary = "Delete auditorium", description = "Rejected while any schedule references the auditorium")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Auditorium deleted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Auditorium not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Auditorium still scheduled")
    })
    @DeleteMapping("/{auditoriumId}")
    public ResponseEntity<ApiResponse<Void>> deleteAuditorium(@PathVariable Long auditoriumId) {
        auditoriumService.deleteAuditorium(auditoriumId);
        return ResponseEntity.ok(ApiResponse.ok());
    }
}
