package com.cinetix.cinema.domain;

import com.cinetix.common.domain.BaseTimeEntity;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One seat in one schedule held by one account. While ACTIVE the booking occupies its slot,
 * which the {@code active_slot} unique key enforces at the storage level.
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = @UniqueConstraint(name = "uk_bookings_active_slot", columnNames = "active_slot"),
        indexes = {
                @Index(name = "idx_bookings_schedule", columnList = "schedule_id"),
                @Index(name = "idx_bookings_account", columnList = "account_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "schedule_id", nullable = false)
    private Long scheduleId;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(nullable = false, length = 10)
    private String seatCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(nullable = false)
    private LocalDateTime bookedAt;

    @Column(name = "active_slot", length = 40)
    private String activeSlot;

    @Version
    private Long version;

    @Builder
    private Booking(Long scheduleId, Long accountId, String seatCode, LocalDateTime bookedAt) {
        this.scheduleId = scheduleId;
        this.accountId = accountId;
        this.seatCode = seatCode;
        this.bookedAt = bookedAt;
        this.status = BookingStatus.ACTIVE;
        this.activeSlot = slotKey(scheduleId, seatCode);
    }

    public static String slotKey(Long scheduleId, String seatCode) {
        return scheduleId + "/" + seatCode;
    }

    public boolean isActive() {
        return status.holdsSlot();
    }

    public void moveTo(Long scheduleId, String seatCode) {
        if (!isActive()) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_ACTIVE,
                    "Cannot change seat of booking " + id + ": status=" + status);
        }
        this.scheduleId = scheduleId;
        this.seatCode = seatCode;
        this.activeSlot = slotKey(scheduleId, seatCode);
    }

    /**
     * @return true if the status changed, false if the booking was already cancelled
     */
    public boolean cancel() {
        return release(BookingStatus.CANCELLED);
    }

    /**
     * @return true if the status changed, false if the booking had already expired
     */
    public boolean expire() {
        return release(BookingStatus.EXPIRED);
    }

    private boolean release(BookingStatus target) {
        BookingStatus next = status.transitionTo(target);
        if (next == status) {
            return false;
        }
        this.status = next;
        this.activeSlot = null;
        return true;
    }
}
