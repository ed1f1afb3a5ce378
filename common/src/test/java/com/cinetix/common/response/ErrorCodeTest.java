package com.cinetix.common.response;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorCodeTest {

    @Test
    void codes_areUnique() {
        long distinct = Arrays.stream(ErrorCode.values())
                .map(ErrorCode::getCode)
                .distinct()
                .count();

        assertThat(distinct).isEqualTo(ErrorCode.values().length);
    }

    @Test
    void uniquenessViolations_mapToConflict() {
        assertThat(ErrorCode.SEAT_TAKEN.getStatus()).isEqualTo(409);
        assertThat(ErrorCode.ALREADY_PAID.getStatus()).isEqualTo(409);
        assertThat(ErrorCode.RESOURCE_IN_USE.getStatus()).isEqualTo(409);
    }
}
