package com.cinetix.cinema.repository;

import com.cinetix.cinema.domain.Film;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FilmRepository extends JpaRepository<Film, Long> {

    List<Film> findAllByOrderByTitleAsc();
}
