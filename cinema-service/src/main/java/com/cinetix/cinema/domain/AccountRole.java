package com.cinetix.cinema.domain;

public enum AccountRole {
    CUSTOMER,
    ADMIN
}
