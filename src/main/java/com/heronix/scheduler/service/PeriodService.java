package com.heronix.scheduler.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.scheduler.config.SchedulerProperties;
import com.heronix.scheduler.exception.ResourceNotFoundException;
import com.heronix.scheduler.exception.SchedulingValidationException;
import com.heronix.scheduler.model.domain.Period;
import com.heronix.scheduler.model.dto.PeriodDTO;
import com.heronix.scheduler.model.dto.PeriodRequestDTO;
import com.heronix.scheduler.repository.LanguageGroupRepository;
import com.heronix.scheduler.repository.PeriodRepository;
import com.heronix.scheduler.repository.SectionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maintains the bell schedule. Periods may not overlap.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PeriodService {

    private final PeriodRepository periodRepository;
    private final SectionRepository sectionRepository;
    private final LanguageGroupRepository languageGroupRepository;
    private final SchedulerProperties properties;

    @Transactional(readOnly = true)
    public List<PeriodDTO> listPeriods() {
        return periodRepository.findAllByOrderByStartTimeAsc().stream()
                .map(PeriodDTO::fromEntity)
                .toList();
    }

    /**
     * Create a period.
     *
     * @throws SchedulingValidationException if the name is taken, the period is
     *         too short, or it overlaps an existing period
     */
    @Transactional
    public PeriodDTO createPeriod(PeriodRequestDTO request) {
        if (periodRepository.existsByName(request.getName())) {
            throw new SchedulingValidationException("Period " + request.getName() + " already exists");
        }

        Period period = Period.builder()
                .name(request.getName())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .build();

        int minimum = properties.getPeriod().getMinDurationMinutes();
        if (period.durationMinutes() < minimum) {
            throw new SchedulingValidationException("Period must be at least " + minimum + " minutes long");
        }

        for (Period existing : periodRepository.findAll()) {
            if (period.overlaps(existing)) {
                throw new SchedulingValidationException("Period " + period.getName()
                        + " overlaps with period " + existing.getName());
            }
        }

        Period saved = periodRepository.save(period);
        log.info("Created period {} ({} - {})", saved.getName(), saved.getStartTime(), saved.getEndTime());
        return PeriodDTO.fromEntity(saved);
    }

    /**
     * Delete a period. Sections meeting in it keep existing without a period.
     */
    @Transactional
    public void deletePeriod(Long periodId) {
        Period period = periodRepository.findById(periodId)
                .orElseThrow(() -> new ResourceNotFoundException("Period", periodId));

        int detached = sectionRepository.clearPeriod(periodId);
        languageGroupRepository.findAll()
                .forEach(group -> group.getPeriods().removeIf(p -> p.getId().equals(periodId)));
        periodRepository.deleteById(periodId);

        log.info("Deleted period {} ({} sections left without a period)", period.getName(), detached);
    }
}
