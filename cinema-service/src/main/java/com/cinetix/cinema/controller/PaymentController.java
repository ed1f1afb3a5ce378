package com.cinetix.cinema.controller;

import com.cinetix.cinema.dto.request.PaymentRequest;
import com.cinetix.cinema.dto.response.PaymentResponse;
import com.cinetix.cinema.service.PaymentService;
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

@Tag(name = "Payment", description = "Payment ledger")
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @Operation(summary = "Record payment", description = "At most one SUCCESS payment per booking")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Payment recorded"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error, unknown booking/account or non-positive amount"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking already paid or no longer active")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<PaymentResponse>> recordPayment(@Valid @RequestBody PaymentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(paymentService.recordPayment(request)));
    }

    @Operation(summary = "Update payment")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Payment updated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error, unknown booking/account or non-positive amount"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Payment not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking already paid or no longer active")
    })
    @PutMapping("/{paymentId}")
    public ResponseEntity<ApiResponse<PaymentResponse>> updatePayment(
            @PathVariable Long paymentId,
            @Valid @RequestBody PaymentRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.updatePayment(paymentId, request)));
    }

    @Operation(summary = "Get payment")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Payment found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Payment not found")
    })
    @GetMapping("/{paymentId}")
    public ResponseEntity<ApiResponse<PaymentResponse>> getPayment(@PathVariable Long paymentId) {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.getPayment(paymentId)));
    }

    @Operation(summary = "List payments", description = "Newest first")
    @GetMapping
    public ResponseEntity<ApiResponse<List<PaymentResponse>>> getPayments() {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.getPayments()));
    }

    @Operation(summary = "List payments of an account", description = "Newest first")
    @GetMapping("/accounts/{accountId}")
    public ResponseEntity<ApiResponse<List<PaymentResponse>>> getPaymentsByAccount(@PathVariable Long accountId) {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.getPaymentsByAccount(accountId)));
    }

    @Operation(summary = "List payments of a booking", description = "Newest first")
    @GetMapping("/bookings/{bookingId}")
    public ResponseEntity<ApiResponse<List<PaymentResponse>>> getPaymentsByBooking(@PathVariable Long bookingId) {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.getPaymentsByBooking(bookingId)));
    }
}
