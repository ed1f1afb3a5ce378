package com.cinetix.cinema.domain;

import com.cinetix.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "auditoriums")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Auditorium extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false)
    private int capacity;

    @Column(length = 500)
    private String facilities;

    @Builder
    private Auditorium(String name, int capacity, String facilities) {
        this.name = name;
        this.capacity = capacity;
        this.facilities = facilities;
    }

    public void update(String name, int capacity, String facilities) {
        this.name = name;
        this.capacity = capacity;
        this.facilities = facilities;
    }
}
