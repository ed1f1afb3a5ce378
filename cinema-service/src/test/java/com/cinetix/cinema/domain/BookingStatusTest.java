package com.cinetix.cinema.domain;

import com.cinetix.common.exception.BusinessException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingStatusTest {

    @Test
    void transitionTo_fromActive_reachesEitherTerminalState() {
        assertThat(BookingStatus.ACTIVE.transitionTo(BookingStatus.CANCELLED)).isEqualTo(BookingStatus.CANCELLED);
        assertThat(BookingStatus.ACTIVE.transitionTo(BookingStatus.EXPIRED)).isEqualTo(BookingStatus.EXPIRED);
    }

    @Test
    void transitionTo_sameTerminalState_isNoOp() {
        assertThat(BookingStatus.CANCELLED.transitionTo(BookingStatus.CANCELLED)).isEqualTo(BookingStatus.CANCELLED);
        assertThat(BookingStatus.EXPIRED.transitionTo(BookingStatus.EXPIRED)).isEqualTo(BookingStatus.EXPIRED);
    }

    @Test
    void transitionTo_betweenTerminalStates_throws() {
        assertThatThrownBy(() -> BookingStatus.EXPIRED.transitionTo(BookingStatus.CANCELLED))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> BookingStatus.CANCELLED.transitionTo(BookingStatus.EXPIRED))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    void transitionTo_backToActive_throws() {
        assertThatThrownBy(() -> BookingStatus.CANCELLED.transitionTo(BookingStatus.ACTIVE))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("CANCELLED");
    }

    @Test
    void holdsSlot_onlyWhileActive() {
        assertThat(BookingStatus.ACTIVE.holdsSlot()).isTrue();
        assertThat(BookingStatus.CANCELLED.holdsSlot()).isFalse();
        assertThat(BookingStatus.EXPIRED.holdsSlot()).isFalse();
    }
}
