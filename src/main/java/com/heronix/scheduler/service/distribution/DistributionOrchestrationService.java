package com.heronix.scheduler.service.distribution;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.heronix.scheduler.config.SchedulerProperties;
import com.heronix.scheduler.exception.ResourceNotFoundException;
import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.domain.LanguageGroup;
import com.heronix.scheduler.model.domain.Section;
import com.heronix.scheduler.model.dto.BatchDistributionResultDTO;
import com.heronix.scheduler.model.dto.ClearResultDTO;
import com.heronix.scheduler.model.dto.DistributionResultDTO;
import com.heronix.scheduler.model.dto.DistributionStatusDTO;
import com.heronix.scheduler.model.dto.LanguageGroupResultDTO;
import com.heronix.scheduler.model.dto.SectionRosterDTO;
import com.heronix.scheduler.repository.CourseRepository;
import com.heronix.scheduler.repository.LanguageGroupRepository;
import com.heronix.scheduler.repository.SectionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a full distribution and manages existing enrollments.
 *
 * A full run clears every section, rotates every language group, distributes
 * the remaining courses hardest first and finally validates the result. The
 * clear step and every course or group commit separately, so each unit sees
 * the placements of the units before it and one failing unit does not undo
 * the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DistributionOrchestrationService {

    private final CourseRepository courseRepository;
    private final SectionRepository sectionRepository;
    private final LanguageGroupRepository languageGroupRepository;
    private final CourseDistributionService courseDistributionService;
    private final LanguageGroupDistributionService languageGroupDistributionService;
    private final DistributionValidationService validationService;
    private final SchedulerProperties properties;
    private final TransactionTemplate transactionTemplate;

    /**
     * Distribute every language group and every course with registered students.
     */
    public BatchDistributionResultDTO distributeAll() {
        LocalDateTime startedAt = LocalDateTime.now();
        BatchDistributionResultDTO result = BatchDistributionResultDTO.builder()
                .startedAt(startedAt)
                .build();

        log.info("Starting full distribution run");

        try {
            int removed = transactionTemplate.execute(status -> clearSections(sectionRepository.findAll()));
            log.info("Cleared all existing distributions ({} enrollments removed)", removed);
        } catch (Exception e) {
            log.error("Full distribution aborted, existing enrollments could not be cleared: {}", e.getMessage(), e);
            result.setSuccess(false);
            result.setError("Could not clear existing enrollments: " + e.getMessage());
            result.setCompletedAt(LocalDateTime.now());
            return result;
        }

        List<Long> groupIds = transactionTemplate.execute(status ->
                languageGroupRepository.findAllByOrderByGradeLevelAscIdAsc().stream()
                        .map(LanguageGroup::getId)
                        .toList());
        for (Long groupId : groupIds) {
            LanguageGroupResultDTO groupResult = languageGroupDistributionService.distributeLanguageGroup(groupId);
            result.getLanguageGroups().put(groupId, groupResult);
            if (!groupResult.isSuccess()) {
                result.getWarnings().add("Language group " + groupId + ": " + groupResult.getError());
            }
        }

        List<Long> courseIds = transactionTemplate.execute(status -> orderedCourseIds());
        log.info("Distributing {} courses", courseIds.size());
        for (Long courseId : courseIds) {
            DistributionResultDTO courseResult = courseDistributionService.distributeCourse(courseId);
            result.getCourses().put(courseId, courseResult);
            if (!courseResult.isSuccess()) {
                result.getWarnings().add("Course " + courseId + ": " + courseResult.getError());
            } else if (!courseResult.getUnassignedStudents().isEmpty()) {
                result.getWarnings().add("Course " + courseResult.getCourseName() + ": "
                        + courseResult.getUnassignedStudents().size() + " students unassigned");
            }
        }

        result.setGradeLevelValidation(validationService.validateCoreGradeLevels());
        result.getWarnings().addAll(validationService.collectWarnings());
        result.setSuccess(true);
        result.setCompletedAt(LocalDateTime.now());

        log.info("Full distribution finished: {} language groups, {} courses, {} warnings",
                groupIds.size(), courseIds.size(), result.getWarnings().size());
        return result;
    }

    /**
     * Remove the enrollment of every section of a course. Registrations are kept.
     */
    @Transactional
    public ClearResultDTO clearCourse(Long courseId) {
        if (!courseRepository.existsById(courseId)) {
            throw new ResourceNotFoundException("Course", courseId);
        }
        List<Section> sections = sectionRepository.findByCourse_IdOrderBySectionNumberAsc(courseId);
        int removed = clearSections(sections);
        log.info("Cleared distribution of course {} ({} enrollments removed)", courseId, removed);
        return ClearResultDTO.builder()
                .success(true)
                .courseId(courseId)
                .sectionsCleared(sections.size())
                .enrollmentsRemoved(removed)
                .build();
    }

    /**
     * Remove the enrollment of every section. Registrations are kept.
     */
    @Transactional
    public ClearResultDTO clearAll() {
        List<Section> sections = sectionRepository.findAll();
        int removed = clearSections(sections);
        log.info("Cleared all distributions ({} enrollments removed)", removed);
        return ClearResultDTO.builder()
                .success(true)
                .sectionsCleared(sections.size())
                .enrollmentsRemoved(removed)
                .build();
    }

    /**
     * Current enrollment of a course's sections.
     */
    @Transactional(readOnly = true)
    public DistributionStatusDTO getStatus(Long courseId) {
        Course course = courseRepository.findById(courseId)
                .orElseThrow(() -> new ResourceNotFoundException("Course", courseId));

        List<SectionRosterDTO> sections = sectionRepository.findByCourse_IdOrderBySectionNumberAsc(courseId)
                .stream()
                .map(SectionRosterDTO::fromEntity)
                .toList();
        int enrolled = sections.stream().mapToInt(SectionRosterDTO::getEnrolledCount).sum();

        return DistributionStatusDTO.builder()
                .courseId(course.getId())
                .courseName(course.getName())
                .registeredCount(course.getRegisteredStudents().size())
                .enrolledCount(enrolled)
                .distributed(enrolled > 0)
                .sections(sections)
                .build();
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private int clearSections(List<Section> sections) {
        int removed = 0;
        for (Section section : sections) {
            removed += section.getEnrolledCount();
            section.clearEnrollment();
        }
        return removed;
    }

    /**
     * Courses outside language groups with registered students, by configured
     * type priority, then fewest sections, then most registered students.
     */
    private List<Long> orderedCourseIds() {
        SchedulerProperties.DistributionConfig config = properties.getDistribution();
        return courseRepository.findDistributableCourses().stream()
                .map(course -> new RankedCourse(
                        course.getId(),
                        config.priorityOf(course.getCourseType()),
                        sectionRepository.countByCourse_Id(course.getId()),
                        course.getRegisteredStudents().size()))
                .sorted(Comparator.comparingInt(RankedCourse::priority)
                        .thenComparingLong(RankedCourse::sectionCount)
                        .thenComparing(Comparator.comparingInt(RankedCourse::registered).reversed())
                        .thenComparingLong(RankedCourse::courseId))
                .map(RankedCourse::courseId)
                .toList();
    }

    private record RankedCourse(Long courseId, int priority, long sectionCount, int registered) {}
}
