package com.cinetix.cinema.dto.response;

import com.cinetix.cinema.domain.Auditorium;

public record AuditoriumResponse(
        Long id,
        String name,
        int capacity,
        String facilities
) {
    public static AuditoriumResponse from(Auditorium auditorium) {
        return new AuditoriumResponse(
                auditorium.getId(),
                auditorium.getName(),
                auditorium.getCapacity(),
                auditorium.getFacilities()
        );
    }
}
