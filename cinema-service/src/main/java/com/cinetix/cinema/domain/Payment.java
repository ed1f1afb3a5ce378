package com.cinetix.cinema.domain;

import com.cinetix.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A payment attempt against a booking. Only a SUCCESS payment fills {@code settled_booking_id},
 * so the unique key admits one settled payment per booking and any number of PENDING or FAILED ones.
 */
@Entity
@Table(name = "payments",
        uniqueConstraints = @UniqueConstraint(name = "uk_payments_settled_booking", columnNames = "settled_booking_id"),
        indexes = {
                @Index(name = "idx_payments_booking", columnList = "booking_id"),
                @Index(name = "idx_payments_account", columnList = "account_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Payment extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod method;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false)
    private LocalDateTime recordedAt;

    @Column(length = 100)
    private String reference;

    @Column(name = "settled_booking_id")
    private Long settledBookingId;

    @Version
    private Long version;

    @Builder
    private Payment(Long bookingId, Long accountId, BigDecimal amount, PaymentMethod method,
                    PaymentStatus status, String reference, LocalDateTime recordedAt) {
        this.recordedAt = recordedAt;
        apply(bookingId, accountId, amount, method, status, reference);
    }

    /**
     * Replaces the payment details. The original {@code recordedAt} is kept.
     */
    public void revise(Long bookingId, Long accountId, BigDecimal amount, PaymentMethod method,
                       PaymentStatus status, String reference) {
        apply(bookingId, accountId, amount, method, status, reference);
    }

    public boolean isSettled() {
        return status.isSettled();
    }

    private void apply(Long bookingId, Long accountId, BigDecimal amount, PaymentMethod method,
                       PaymentStatus status, String reference) {
        this.bookingId = bookingId;
        this.accountId = accountId;
        this.amount = amount;
        this.method = method;
        this.status = status;
        this.reference = reference;
        this.settledBookingId = status.isSettled() ? bookingId : null;
    }
}
