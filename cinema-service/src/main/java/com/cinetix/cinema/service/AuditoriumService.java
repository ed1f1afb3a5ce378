package com.cinetix.cinema.service;

import com.cinetix.cinema.domain.Auditorium;
import com.cinetix.cinema.dto.request.AuditoriumRequest;
import com.cinetix.cinema.dto.response.AuditoriumResponse;
import com.cinetix.cinema.jooq.AuditoriumJooqRepository;
import com.cinetix.cinema.repository.AuditoriumRepository;
import com.cinetix.cinema.repository.ScheduleRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditoriumService {

    private final AuditoriumRepository auditoriumRepository;
    private final AuditoriumJooqRepository auditoriumJooqRepository;
    private final ScheduleRepository scheduleRepository;

    @Transactional
    public AuditoriumResponse createAuditorium(AuditoriumRequest request) {
        Auditorium auditorium = auditoriumRepository.save(Auditorium.builder()
                .name(request.name())
                .capacity(request.capacity())
                .facilities(request.facilities())
                .build());

        log.info("Created auditorium id={}, name={}, capacity={}",
                auditorium.getId(), auditorium.getName(), auditorium.getCapacity());
        return AuditoriumResponse.from(auditorium);
    }

    @Transactional
    public AuditoriumResponse updateAuditorium(Long auditoriumId, AuditoriumRequest request) {
        Auditorium auditorium = findAuditorium(auditoriumId);
        auditorium.update(request.name(), request.capacity(), request.facilities());
        return AuditoriumResponse.from(auditorium);
    }

    @Transactional(readOnly = true)
    public AuditoriumResponse getAuditorium(Long auditoriumId) {
        return AuditoriumResponse.from(findAuditorium(auditoriumId));
    }

    @Transactional(readOnly = true)
    public List<AuditoriumResponse> getAuditoriums() {
        return auditoriumRepository.findAllByOrderByNameAsc().stream()
                .map(AuditoriumResponse::from)
                .toList();
    }

    @Transactional
    public void deleteAuditorium(Long auditoriumId) {
        if (!auditoriumJooqRepository.lockForUpdate(auditoriumId)) {
            throw new BusinessException(ErrorCode.AUDITORIUM_NOT_FOUND,
                    "Auditorium not found: " + auditoriumId);
        }
        if (scheduleRepository.existsByAuditoriumId(auditoriumId)) {
            throw new BusinessException(ErrorCode.RESOURCE_IN_USE,
                    "Auditorium is still scheduled: " + auditoriumId);
        }
        auditoriumRepository.deleteById(auditoriumId);
        log.info("Deleted auditorium id={}", auditoriumId);
    }

    private Auditorium findAuditorium(Long auditoriumId) {
        return auditoriumRepository.findById(auditoriumId)
                .orElseThrow(() -> new BusinessException(ErrorCode.AUDITORIUM_NOT_FOUND,
                        "Auditorium not found: " + auditoriumId));
    }
}
