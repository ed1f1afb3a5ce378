package com.cinetix.cinema.controller;

import com.cinetix.cinema.dto.request.ChangeSeatRequest;
import com.cinetix.cinema.dto.request.ReserveSeatRequest;
import com.cinetix.cinema.dto.response.BookingResponse;
import com.cinetix.cinema.service.BookingService;
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

@Tag(name = "Booking", description = "Seat reservation and booking management")
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @Operation(summary = "Reserve seat", description = "Reserve one seat with 3-tier protection (Redis lock + row lock + unique slot key)")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Seat reserved"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error or unknown schedule/account"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Seat already booked")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<BookingResponse>> reserve(@Valid @RequestBody ReserveSeatRequest request) {
        var booking = bookingService.reserve(request.scheduleId(), request.accountId(), request.seatCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(booking));
    }

    @Operation(summary = "Change seat", description = "Move an active booking to another schedule/seat in place")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Seat changed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error or unknown schedule"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Seat already booked or booking no longer active")
    })
    @PutMapping("/{bookingId}/seat")
    public ResponseEntity<ApiResponse<BookingResponse>> changeSeat(
            @PathVariable Long bookingId,
            @Valid @RequestBody ChangeSeatRequest request) {
        var booking = bookingService.changeSeat(bookingId, request.scheduleId(), request.seatCode());
        return ResponseEntity.ok(ApiResponse.ok(booking));
    }

    @Operation(summary = "Cancel booking", description = "Idempotent; frees the seat")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking cancelled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking already expired")
    })
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<BookingResponse>> cancel(@PathVariable Long bookingId) {
        return ResponseEntity.ok(ApiResponse.ok(bookingService.cancel(bookingId)));
    }

    @Operation(summary = "Expire booking", description = "Idempotent; frees the seat")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking expired"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking already cancelled")
    })
    @PostMapping("/{bookingId}/expire")
    public ResponseEntity<ApiResponse<BookingResponse>> expire(@PathVariable Long bookingId) {
        return ResponseEntity.ok(ApiResponse.ok(bookingService.expire(bookingId)));
    }

    @Operation(summary = "Get booking")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found")
    })
    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(@PathVariable Long bookingId) {
        return ResponseEntity.ok(ApiResponse.ok(bookingService.getBooking(bookingId)));
    }

    @Operation(summary = "List bookings", description = "Newest first; optionally restricted to one account")
    @GetMapping
    public ResponseEntity<ApiResponse<List<BookingResponse>>> getBookings(
            @RequestParam(required = false) Long accountId) {
        var bookings = accountId != null
                ? bookingService.getAccountBookings(accountId)
                : bookingService.getBookings();
        return ResponseEntity.ok(ApiResponse.ok(bookings));
    }
}
