package com.cinetix.cinema.service;

public enum EntityKind {
    FILM,
    AUDITORIUM,
    SCHEDULE,
    ACCOUNT,
    BOOKING,
    PAYMENT
}
