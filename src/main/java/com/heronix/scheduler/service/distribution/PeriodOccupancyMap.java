package com.heronix.scheduler.service.distribution;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory view of which courses each student already attends in each period.
 *
 * Built once per distribution run from the current enrollments of the students
 * involved, then kept up to date as the run places students. Not thread-safe;
 * one instance belongs to one run.
 */
public class PeriodOccupancyMap {

    // studentId -> periodId -> courseIds
    private final Map<Long, Map<Long, Set<Long>>> occupancy = new HashMap<>();

    /**
     * Build from placement rows of the form [studentId, periodId, courseId].
     */
    public static PeriodOccupancyMap fromPlacements(List<Object[]> placements) {
        PeriodOccupancyMap map = new PeriodOccupancyMap();
        for (Object[] row : placements) {
            map.place((Long) row[0], (Long) row[1], (Long) row[2]);
        }
        return map;
    }

    /**
     * Check whether the student already attends a different course in the period.
     */
    public boolean isBlocked(Long studentId, Long periodId, Long courseId) {
        Set<Long> courses = coursesIn(studentId, periodId);
        for (Long occupying : courses) {
            if (!occupying.equals(courseId)) {
                return true;
            }
        }
        return false;
    }

    public void place(Long studentId, Long periodId, Long courseId) {
        occupancy.computeIfAbsent(studentId, id -> new HashMap<>())
                .computeIfAbsent(periodId, id -> new HashSet<>())
                .add(courseId);
    }

    public Set<Long> coursesIn(Long studentId, Long periodId) {
        Map<Long, Set<Long>> periods = occupancy.get(studentId);
        if (periods == null) {
            return Collections.emptySet();
        }
        return periods.getOrDefault(periodId, Collections.emptySet());
    }

    public int studentCount() {
        return occupancy.size();
    }
}
