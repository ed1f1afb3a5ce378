package com.cinetix.cinema.domain;

public enum PaymentMethod {
    CARD,
    EWALLET,
    BANK_TRANSFER
}
