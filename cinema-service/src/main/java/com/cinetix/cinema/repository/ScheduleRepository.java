package com.cinetix.cinema.repository;

import com.cinetix.cinema.domain.Schedule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScheduleRepository extends JpaRepository<Schedule, Long> {

    List<Schedule> findAllByOrderByShowTimeAscIdAsc();

    boolean existsByFilmId(Long filmId);

    boolean existsByAuditoriumId(Long auditoriumId);
}
