package com.cinetix.cinema.repository;

import com.cinetix.cinema.domain.Booking;
import com.cinetix.cinema.domain.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findAllByOrderByBookedAtDescIdDesc();

    List<Booking> findByAccountIdOrderByBookedAtDescIdDesc(Long accountId);

    boolean existsByScheduleIdAndStatusNot(Long scheduleId, BookingStatus status);

    long countByScheduleIdAndStatus(Long scheduleId, BookingStatus status);
}
