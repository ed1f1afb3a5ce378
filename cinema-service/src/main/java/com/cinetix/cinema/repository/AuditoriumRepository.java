package com.cinetix.cinema.repository;

import com.cinetix.cinema.domain.Auditorium;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditoriumRepository extends JpaRepository<Auditorium, Long> {

    List<Auditorium> findAllByOrderByNameAsc();
}
