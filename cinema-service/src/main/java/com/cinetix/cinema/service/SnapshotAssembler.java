package com.cinetix.cinema.service;

import com.cinetix.cinema.domain.*;
import com.cinetix.cinema.dto.response.*;
import com.cinetix.cinema.repository.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds response graphs (payment -> booking -> schedule -> auditorium/film, plus accounts)
 * from id references. Must run inside the caller's transaction so every snapshot comes from
 * the same read. A reference whose target is gone yields a null snapshot.
 */
@Component
@RequiredArgsConstructor
public class SnapshotAssembler {

    private final FilmRepository filmRepository;
    private final AuditoriumRepository auditoriumRepository;
    private final ScheduleRepository scheduleRepository;
    private final AccountRepository accountRepository;
    private final BookingRepository bookingRepository;

    public ScheduleResponse schedule(Schedule schedule) {
        return schedules(List.of(schedule)).get(0);
    }

    public List<ScheduleResponse> schedules(List<Schedule> schedules) {
        Map<Long, FilmResponse> films = byId(filmRepository.findAllById(
                ids(schedules, Schedule::getFilmId)), Film::getId, FilmResponse::from);
        Map<Long, AuditoriumResponse> auditoriums = byId(auditoriumRepository.findAllById(
                ids(schedules, Schedule::getAuditoriumId)), Auditorium::getId, AuditoriumResponse::from);

        return schedules.stream()
                .map(s -> ScheduleResponse.of(s, auditoriums.get(s.getAuditoriumId()), films.get(s.getFilmId())))
                .toList();
    }

    public BookingResponse booking(Booking booking) {
        return bookings(List.of(booking)).get(0);
    }

    public List<BookingResponse> bookings(List<Booking> bookings) {
        List<Schedule> scheduleEntities = scheduleRepository.findAllById(ids(bookings, Booking::getScheduleId));
        Map<Long, ScheduleResponse> schedules = schedules(scheduleEntities).stream()
                .collect(Collectors.toMap(ScheduleResponse::id, Function.identity()));
        Map<Long, AccountResponse> accounts = accounts(ids(bookings, Booking::getAccountId));

        return bookings.stream()
                .map(b -> BookingResponse.of(b, schedules.get(b.getScheduleId()), accounts.get(b.getAccountId())))
                .toList();
    }

    public PaymentResponse payment(Payment payment) {
        return payments(List.of(payment)).get(0);
    }

    public List<PaymentResponse> payments(List<Payment> payments) {
        List<Booking> bookingEntities = bookingRepository.findAllById(ids(payments, Payment::getBookingId));
        Map<Long, BookingResponse> bookings = bookings(bookingEntities).stream()
                .collect(Collectors.toMap(BookingResponse::id, Function.identity()));
        Map<Long, AccountResponse> accounts = accounts(ids(payments, Payment::getAccountId));

        return payments.stream()
                .map(p -> PaymentResponse.of(p, bookings.get(p.getBookingId()), accounts.get(p.getAccountId())))
                .toList();
    }

    private Map<Long, AccountResponse> accounts(Collection<Long> accountIds) {
        return byId(accountRepository.findAllById(accountIds), Account::getId, AccountResponse::from);
    }

    private static <T> List<Long> ids(Collection<T> items, Function<T, Long> idOf) {
        return items.stream().map(idOf).distinct().toList();
    }

    private static <E, R> Map<Long, R> byId(List<E> entities, Function<E, Long> idOf, Function<E, R> mapper) {
        return entities.stream().collect(Collectors.toMap(idOf, mapper));
    }
}
