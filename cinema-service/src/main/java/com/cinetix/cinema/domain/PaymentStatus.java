package com.cinetix.cinema.domain;

public enum PaymentStatus {
    PENDING,
    SUCCESS,
    FAILED;

    public boolean isSettled() {
        return this == SUCCESS;
    }
}
