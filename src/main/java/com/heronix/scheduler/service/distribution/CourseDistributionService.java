package com.heronix.scheduler.service.distribution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Collectors;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import com.heronix.scheduler.config.SchedulerProperties;
import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.domain.Section;
import com.heronix.scheduler.model.domain.User;
import com.heronix.scheduler.model.dto.DistributionResultDTO;
import com.heronix.scheduler.model.dto.SectionRosterDTO;
import com.heronix.scheduler.model.dto.StudentSummaryDTO;
import com.heronix.scheduler.model.dto.UnassignedStudentDTO;
import com.heronix.scheduler.repository.CourseRepository;
import com.heronix.scheduler.repository.SectionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Places the registered students of one course into the course's sections.
 *
 * Students with the fewest usable sections are placed first, each into the
 * usable section with the fewest students. A section is usable when the
 * student has no other course in its period and the section still has room.
 * Ties are broken with a random source drawn fresh for every run, so groupings
 * vary between runs unless a seed is configured.
 *
 * Each call is one transaction: a failure leaves the previous enrollment in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseDistributionService {

    private final CourseRepository courseRepository;
    private final SectionRepository sectionRepository;
    private final PeriodConflictChecker conflictChecker;
    private final SchedulerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final ObjectProvider<Random> distributionRandom;

    /**
     * Distribute the registered students of a course across its sections.
     *
     * @param courseId the course to distribute
     * @return per-section rosters and the students that could not be placed,
     *         or a failure result when the course cannot be distributed
     */
    public DistributionResultDTO distributeCourse(Long courseId) {
        log.info("Starting distribution for course {}", courseId);

        try {
            DistributionResultDTO result = transactionTemplate.execute(status -> {
                DistributionResultDTO outcome = distribute(courseId);
                if (!outcome.isSuccess()) {
                    status.setRollbackOnly();
                }
                return outcome;
            });

            if (result.isSuccess()) {
                log.info("Distributed course {}: {} of {} students placed, {} unassigned",
                        result.getCourseName(), result.getAssignedCount(), result.getTotalStudents(),
                        result.getUnassignedStudents().size());
            } else {
                log.warn("Course {} was not distributed: {}", courseId, result.getError());
            }
            return result;

        } catch (Exception e) {
            log.error("Distribution of course {} failed: {}", courseId, e.getMessage(), e);
            return DistributionResultDTO.failure(courseId, e.getMessage());
        }
    }

    private DistributionResultDTO distribute(Long courseId) {
        Course course = courseRepository.findById(courseId).orElse(null);
        if (course == null) {
            return DistributionResultDTO.failure(courseId, "Course with id " + courseId + " not found");
        }

        List<Section> sections = sectionRepository.findByCourse_IdOrderBySectionNumberAsc(courseId);
        if (sections.isEmpty()) {
            return DistributionResultDTO.failure(courseId, "Course " + course.getName() + " has no sections");
        }

        List<String> withoutPeriod = sections.stream()
                .filter(section -> section.getPeriod() == null)
                .map(Section::getName)
                .toList();
        if (!withoutPeriod.isEmpty()) {
            return DistributionResultDTO.failure(courseId, "Course " + course.getName()
                    + " has sections without assigned periods: " + String.join(", ", withoutPeriod));
        }

        List<User> students = new ArrayList<>(course.getRegisteredStudents());
        if (students.isEmpty()) {
            return DistributionResultDTO.failure(courseId, "No students registered for " + course.getName());
        }
        students.sort(Comparator.comparing(User::getId));

        sections.forEach(Section::clearEnrollment);
        Random random = distributionRandom.getObject();

        Map<Integer, Long> studentsPerGrade = students.stream()
                .collect(Collectors.groupingBy(this::gradeOf, Collectors.counting()));
        PeriodOccupancyMap occupancy = conflictChecker.loadOccupancy(
                students.stream().map(User::getId).toList());
        PlacementCounter counter = new PlacementCounter(studentsPerGrade);

        // Hardest to place first, random among equals
        Map<Long, Double> tiebreak = new HashMap<>();
        students.forEach(student -> tiebreak.put(student.getId(), random.nextDouble()));
        Map<Long, Integer> availableCount = students.stream().collect(Collectors.toMap(
                User::getId,
                student -> availableSections(student, sections, occupancy, counter, courseId).size()));
        students.sort(Comparator
                .comparing((User student) -> availableCount.get(student.getId()))
                .thenComparing(student -> tiebreak.get(student.getId())));

        List<UnassignedStudentDTO> unassigned = new ArrayList<>();
        String reason = properties.getDistribution().getUnassignedReason();

        for (User student : students) {
            List<Section> available = availableSections(student, sections, occupancy, counter, courseId);
            if (available.isEmpty()) {
                log.warn("Cannot assign student {} to course {}: no available sections or period capacity reached",
                        student.getId(), course.getName());
                unassigned.add(unassignedEntry(student, reason));
                continue;
            }

            Section target = leastFilled(available, random);

            if (conflictChecker.hasPeriodConflict(student.getId(), target.getPeriod().getId(), courseId)) {
                log.warn("Final check found a period conflict for student {} in period {}",
                        student.getId(), target.getPeriod().getName());
                unassigned.add(unassignedEntry(student, reason));
                continue;
            }

            target.enroll(student);
            occupancy.place(student.getId(), target.getPeriod().getId(), courseId);
            counter.record(target.getPeriod().getId(), gradeOf(student));
            log.debug("Assigned student {} (grade {}) to section {} in period {}",
                    student.getId(), student.getGradeLevel(), target.getName(), target.getPeriod().getName());
        }

        return DistributionResultDTO.builder()
                .success(true)
                .courseId(course.getId())
                .courseName(course.getName())
                .courseCode(course.getCode())
                .totalStudents(students.size())
                .numSections(sections.size())
                .distribution(sections.stream().map(SectionRosterDTO::fromEntity).toList())
                .unassignedStudents(unassigned)
                .build();
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private List<Section> availableSections(User student, List<Section> sections,
            PeriodOccupancyMap occupancy, PlacementCounter counter, Long courseId) {
        Integer grade = gradeOf(student);
        return sections.stream()
                .filter(section -> !occupancy.isBlocked(student.getId(), section.getPeriod().getId(), courseId))
                .filter(section -> counter.hasRoom(section.getPeriod().getId(), grade))
                .filter(section -> !section.isAtCapacity())
                .toList();
    }

    private Section leastFilled(List<Section> available, Random random) {
        List<Section> candidates = new ArrayList<>(available);
        Collections.shuffle(candidates, random);
        return candidates.stream()
                .min(Comparator.comparingInt(Section::getEnrolledCount))
                .orElseThrow();
    }

    private Integer gradeOf(User student) {
        return Objects.requireNonNullElse(student.getGradeLevel(), 0);
    }

    private UnassignedStudentDTO unassignedEntry(User student, String reason) {
        return UnassignedStudentDTO.builder()
                .student(StudentSummaryDTO.fromEntity(student))
                .reason(reason)
                .build();
    }

    /**
     * Students of each grade placed in each period by the current run. A period
     * never takes more students of a grade than the course has registered for it.
     */
    private static final class PlacementCounter {

        private final Map<Integer, Long> limits;
        private final Map<Long, Map<Integer, Long>> placed = new HashMap<>();

        PlacementCounter(Map<Integer, Long> limits) {
            this.limits = limits;
        }

        boolean hasRoom(Long periodId, Integer grade) {
            long count = placed.getOrDefault(periodId, Map.of()).getOrDefault(grade, 0L);
            return count < limits.getOrDefault(grade, 0L);
        }

        void record(Long periodId, Integer grade) {
            placed.computeIfAbsent(periodId, id -> new HashMap<>())
                    .merge(grade, 1L, Long::sum);
        }
    }
}
