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
 * A screening of one film in one auditorium. References are held by id only.
 */
@Entity
@Table(name = "schedules", indexes = {
        @Index(name = "idx_schedules_film", columnList = "film_id"),
        @Index(name = "idx_schedules_auditorium", columnList = "auditorium_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Schedule extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "auditorium_id", nullable = false)
    private Long auditoriumId;

    @Column(name = "film_id", nullable = false)
    private Long filmId;

    @Column(nullable = false)
    private LocalDateTime showTime;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Builder
    private Schedule(Long auditoriumId, Long filmId, LocalDateTime showTime, BigDecimal price) {
        this.auditoriumId = auditoriumId;
        this.filmId = filmId;
        this.showTime = showTime;
        this.price = price;
    }

    public void reschedule(Long auditoriumId, Long filmId, LocalDateTime showTime, BigDecimal price) {
        this.auditoriumId = auditoriumId;
        this.filmId = filmId;
        this.showTime = showTime;
        this.price = price;
    }
}
