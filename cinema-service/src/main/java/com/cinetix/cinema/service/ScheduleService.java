package com.cinetix.cinema.service;

import com.cinetix.cinema.domain.BookingStatus;
import com.cinetix.cinema.domain.Schedule;
import com.cinetix.cinema.dto.request.ScheduleRequest;
import com.cinetix.cinema.dto.response.ScheduleResponse;
import com.cinetix.cinema.jooq.AuditoriumJooqRepository;
import com.cinetix.cinema.jooq.FilmJooqRepository;
import com.cinetix.cinema.jooq.ScheduleJooqRepository;
import com.cinetix.cinema.repository.BookingRepository;
import com.cinetix.cinema.repository.ScheduleRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final ScheduleRepository scheduleRepository;
    private final ScheduleJooqRepository scheduleJooqRepository;
    private final FilmJooqRepository filmJooqRepository;
    private final AuditoriumJooqRepository auditoriumJooqRepository;
    private final BookingRepository bookingRepository;
    private final SnapshotAssembler snapshotAssembler;
    private final Clock clock;

    @Transactional
    public ScheduleResponse createSchedule(ScheduleRequest request) {
        validate(request);

        Schedule schedule = scheduleRepository.save(Schedule.builder()
                .auditoriumId(request.auditoriumId())
                .filmId(request.filmId())
                .showTime(request.showTime())
                .price(request.price())
                .build());

        log.info("Created schedule id={}, filmId={}, auditoriumId={}, showTime={}",
                schedule.getId(), schedule.getFilmId(), schedule.getAuditoriumId(), schedule.getShowTime());
        return snapshotAssembler.schedule(schedule);
    }

    @Transactional
    public ScheduleResponse updateSchedule(Long scheduleId, ScheduleRequest request) {
        Schedule schedule = findSchedule(scheduleId);
        validate(request);

        schedule.reschedule(request.auditoriumId(), request.filmId(), request.showTime(), request.price());

        log.info("Updated schedule id={}, showTime={}", scheduleId, schedule.getShowTime());
        return snapshotAssembler.schedule(schedule);
    }

    @Transactional(readOnly = true)
    public ScheduleResponse getSchedule(Long scheduleId) {
        return snapshotAssembler.schedule(findSchedule(scheduleId));
    }

    @Transactional(readOnly = true)
    public List<ScheduleResponse> getSchedules() {
        return snapshotAssembler.schedules(scheduleRepository.findAllByOrderByShowTimeAscIdAsc());
    }

    /**
     * Rejected while any non-cancelled booking references the schedule. The schedule row lock
     * is the same one reservations take, so no booking can appear between the check and the delete.
     */
    @Transactional
    public void deleteSchedule(Long scheduleId) {
        if (!scheduleJooqRepository.lockForUpdate(scheduleId)) {
            throw new BusinessException(ErrorCode.SCHEDULE_NOT_FOUND,
                    "Schedule not found: " + scheduleId);
        }
        if (bookingRepository.existsByScheduleIdAndStatusNot(scheduleId, BookingStatus.CANCELLED)) {
            throw new BusinessException(ErrorCode.RESOURCE_IN_USE,
                    "Schedule has bookings: " + scheduleId);
        }
        scheduleRepository.deleteById(scheduleId);
        log.info("Deleted schedule id={}", scheduleId);
    }

    /**
     * Locks the referenced auditorium and film rows for the rest of the transaction, so a
     * concurrent delete either sees this schedule or makes the references unresolvable.
     */
    private void validate(ScheduleRequest request) {
        if (!auditoriumJooqRepository.lockForUpdate(request.auditoriumId())) {
            throw new BusinessException(ErrorCode.REFERENCE_NOT_FOUND,
                    "Referenced auditorium not found: " + request.auditoriumId());
        }
        if (!filmJooqRepository.lockForUpdate(request.filmId())) {
            throw new BusinessException(ErrorCode.REFERENCE_NOT_FOUND,
                    "Referenced film not found: " + request.filmId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (!request.showTime().isAfter(now)) {
            throw new BusinessException(ErrorCode.INVALID_TEMPORAL_VALUE,
                    "Show time must be after " + now + ": " + request.showTime());
        }
        // price column is numeric(12,2)
        if (request.price().signum() <= 0 || request.price().stripTrailingZeros().scale() > 2) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY,
                    "Price must be positive with at most 2 decimals: " + request.price());
        }
    }

    private Schedule findSchedule(Long scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SCHEDULE_NOT_FOUND,
                        "Schedule not found: " + scheduleId));
    }
}
