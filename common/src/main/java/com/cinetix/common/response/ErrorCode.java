package com.cinetix.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    RESOURCE_NOT_FOUND(404, "C002", "Resource not found"),
    INTERNAL_ERROR(500, "C003", "Internal server error"),
    REFERENCE_NOT_FOUND(400, "C004", "Referenced resource does not exist"),
    RESOURCE_IN_USE(409, "C005", "Resource is still referenced"),
    INVALID_QUANTITY(400, "C006", "Quantity must be positive"),

    // Catalog
    FILM_NOT_FOUND(404, "F001", "Film not found"),
    AUDITORIUM_NOT_FOUND(404, "F002", "Auditorium not found"),

    // Account
    ACCOUNT_NOT_FOUND(404, "A001", "Account not found"),
    DUPLICATE_ACCOUNT(409, "A002", "Email or login name already exists"),

    // Schedule
    SCHEDULE_NOT_FOUND(404, "S001", "Schedule not found"),
    INVALID_TEMPORAL_VALUE(400, "S002", "Show time must be in the future"),

    // Booking
    SEAT_TAKEN(409, "B001", "Seat is already booked for this schedule"),
    BOOKING_NOT_FOUND(404, "B002", "Booking not found"),
    BOOKING_NOT_ACTIVE(409, "B003", "Booking is no longer active"),
    LOCK_ACQUISITION_FAILED(409, "B004", "Failed to acquire lock"),

    // Payment
    PAYMENT_NOT_FOUND(404, "P001", "Payment not found"),
    ALREADY_PAID(409, "P002", "Booking already has a successful payment");

    private final int status;
    private final String code;
    private final String message;
}
