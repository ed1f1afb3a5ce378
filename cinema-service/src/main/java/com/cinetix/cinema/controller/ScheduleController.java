package com.cinetix.cinema.controller;

import com.cinetix.cinema.dto.request.ScheduleRequest;
import com.cinetix.cinema.dto.response.ScheduleResponse;
import com.cinetix.cinema.service.ScheduleService;
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

@Tag(name = "Schedule", description = "Screening schedule management")
@RestController
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;

    @Operation(summary = "Create schedule", description = "Auditorium and film must exist and the show time must be in the future")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Schedule created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unknown auditorium/film, past show time or non-positive price")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<ScheduleResponse>> createSchedule(@Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(scheduleService.createSchedule(request)));
    }

    @Operation(summary = "Update schedule", description = "Replace auditorium, film, show time and price")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Schedule updated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unknown auditorium/film, past show time or non-positive price"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Schedule not found")
    })
    @PutMapping("/{scheduleId}")
    public ResponseEntity<ApiResponse<ScheduleResponse>> updateSchedule(
            @PathVariable Long scheduleId,
            @Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(scheduleService.updateSchedule(scheduleId, request)));
    }

    @Operation(summary = "Get schedule")
    @GetMapping("/{scheduleId}")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getSchedule(@PathVariable Long scheduleId) {
        return ResponseEntity.ok(ApiResponse.ok(scheduleService.getSchedule(scheduleId)));
    }

    @Operation(summary = "List schedules", description = "Ordered by show time")
    @GetMapping
    public ResponseEntity<ApiResponse<List<ScheduleResponse>>> getSchedules() {
        return ResponseEntity.ok(ApiResponse.ok(scheduleService.getSchedules()));
    }

    @Operation(summary = "Delete schedule", description = "Rejected while any non-cancelled booking references the schedule")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Schedule deleted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Schedule not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Schedule has bookings")
    })
    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(@PathVariable Long scheduleId) {
        scheduleService.deleteSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.ok());
    }
}
