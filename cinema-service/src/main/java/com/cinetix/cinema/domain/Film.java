package com.cinetix.cinema.domain;

import com.cinetix.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "films")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Film extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 50)
    private String genre;

    @Column(nullable = false)
    private int durationMinutes;

    @Column(length = 1000)
    private String description;

    @Builder
    private Film(String title, String genre, int durationMinutes, String description) {
        this.title = title;
        this.genre = genre;
        this.durationMinutes = durationMinutes;
        this.description = description;
    }

    public void update(String title, String genre, int durationMinutes, String description) {
        this.title = title;
        this.genre = genre;
        this.durationMinutes = durationMinutes;
        this.description = description;
    }
}
