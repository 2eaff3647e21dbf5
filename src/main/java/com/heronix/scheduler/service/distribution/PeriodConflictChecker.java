package com.heronix.scheduler.service.distribution;

import java.util.Collection;

import org.springframework.stereotype.Component;

import com.heronix.scheduler.repository.SectionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Detects period conflicts: a student sitting in two different courses that
 * meet in the same period.
 *
 * Sections of the same course never conflict with each other. Trimesters are
 * not considered; any enrollment in a period occupies it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PeriodConflictChecker {

    private final SectionRepository sectionRepository;

    /**
     * Check the stored enrollments for a conflict.
     *
     * @param studentId the student to place
     * @param periodId  the period of the candidate section
     * @param courseId  the course being distributed
     * @return true if the student already attends another course in the period
     */
    public boolean hasPeriodConflict(Long studentId, Long periodId, Long courseId) {
        boolean conflict = sectionRepository.existsEnrollmentInPeriodOutsideCourse(studentId, periodId, courseId);
        if (conflict) {
            log.warn("Period conflict: student {} already has a class in period {}", studentId, periodId);
        }
        return conflict;
    }

    /**
     * Load the current placements of the given students into a fresh occupancy map.
     */
    public PeriodOccupancyMap loadOccupancy(Collection<Long> studentIds) {
        if (studentIds.isEmpty()) {
            return new PeriodOccupancyMap();
        }
        PeriodOccupancyMap map = PeriodOccupancyMap.fromPlacements(
                sectionRepository.findPlacementsOfStudents(studentIds));
        log.debug("Loaded period occupancy for {} of {} students", map.studentCount(), studentIds.size());
        return map;
    }
}
