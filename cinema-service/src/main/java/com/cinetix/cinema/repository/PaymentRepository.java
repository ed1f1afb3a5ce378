package com.cinetix.cinema.repository;

import com.cinetix.cinema.domain.Payment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Every list is ordered newest first by {@code recordedAt}, id breaking ties.
 */
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    List<Payment> findAllByOrderByRecordedAtDescIdDesc();

    List<Payment> findByAccountIdOrderByRecordedAtDescIdDesc(Long accountId);

    List<Payment> findByBookingIdOrderByRecordedAtDescIdDesc(Long bookingId);
}
