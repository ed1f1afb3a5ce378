package com.cinetix.cinema.domain;

import com.cinetix.cinema.TestFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentTest {

    @Test
    void builder_successPayment_settlesBooking() {
        Payment payment = TestFixtures.payment(1L, 5L, 100L, PaymentStatus.SUCCESS);

        assertThat(payment.isSettled()).isTrue();
        assertThat(payment.getSettledBookingId()).isEqualTo(5L);
    }

    @Test
    void builder_pendingOrFailedPayment_leavesSettlementKeyEmpty() {
        assertThat(TestFixtures.payment(1L, 5L, 100L, PaymentStatus.PENDING).getSettledBookingId()).isNull();
        assertThat(TestFixtures.payment(2L, 5L, 100L, PaymentStatus.FAILED).getSettledBookingId()).isNull();
    }

    @Test
    void revise_toSuccess_setsSettlementKeyAndKeepsRecordedAt() {
        Payment payment = TestFixtures.payment(1L, 5L, 100L, PaymentStatus.PENDING);

        payment.revise(5L, 100L, BigDecimal.valueOf(80000), PaymentMethod.EWALLET, PaymentStatus.SUCCESS, "TXN9");

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.SUCCESS);
        assertThat(payment.getSettledBookingId()).isEqualTo(5L);
        assertThat(payment.getAmount()).isEqualByComparingTo("80000");
        assertThat(payment.getMethod()).isEqualTo(PaymentMethod.EWALLET);
        assertThat(payment.getRecordedAt()).isEqualTo(TestFixtures.NOW);
    }

    @Test
    void revise_fromSuccessToFailed_clearsSettlementKey() {
        Payment payment = TestFixtures.payment(1L, 5L, 100L, PaymentStatus.SUCCESS);

        payment.revise(5L, 100L, BigDecimal.valueOf(75000), PaymentMethod.CARD, PaymentStatus.FAILED, null);

        assertThat(payment.getSettledBookingId()).isNull();
        assertThat(payment.getReference()).isNull();
    }
}
