package com.heronix.scheduler.service.distribution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.domain.LanguageGroup;
import com.heronix.scheduler.model.domain.Period;
import com.heronix.scheduler.model.domain.Section;
import com.heronix.scheduler.model.domain.User;
import com.heronix.scheduler.model.dto.LanguageGroupResultDTO;
import com.heronix.scheduler.model.dto.SectionRosterDTO;
import com.heronix.scheduler.model.enums.CourseDuration;
import com.heronix.scheduler.model.enums.UserRole;
import com.heronix.scheduler.repository.LanguageGroupRepository;
import com.heronix.scheduler.repository.SectionRepository;
import com.heronix.scheduler.repository.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rotates a whole grade through the courses of a language group.
 *
 * The grade is shuffled and split across the group's periods. Each period's
 * share stays together and takes every course of the group, one per trimester,
 * so a student meets the same classmates in the same period all year.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LanguageGroupDistributionService {

    static final int MAX_COURSES = 3;

    private final LanguageGroupRepository languageGroupRepository;
    private final UserRepository userRepository;
    private final SectionRepository sectionRepository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectProvider<Random> distributionRandom;

    /**
     * Enroll every student of the group's grade in every course of the group.
     *
     * @param groupId the language group
     * @return the resulting sections, or a failure result; a failure changes nothing
     */
    public LanguageGroupResultDTO distributeLanguageGroup(Long groupId) {
        log.info("Starting distribution for language group {}", groupId);

        try {
            LanguageGroupResultDTO result = transactionTemplate.execute(status -> {
                LanguageGroupResultDTO outcome = distribute(groupId);
                if (!outcome.isSuccess()) {
                    status.setRollbackOnly();
                }
                return outcome;
            });

            if (result.isSuccess()) {
                log.info("Distributed language group {}: {} students across {} sections",
                        result.getGroupName(), result.getTotalStudents(), result.getSections().size());
            } else {
                log.warn("Language group {} was not distributed: {}", groupId, result.getError());
            }
            return result;

        } catch (Exception e) {
            log.error("Distribution of language group {} failed: {}", groupId, e.getMessage(), e);
            return LanguageGroupResultDTO.failure(groupId, e.getMessage());
        }
    }

    private LanguageGroupResultDTO distribute(Long groupId) {
        LanguageGroup group = languageGroupRepository.findById(groupId).orElse(null);
        if (group == null) {
            return LanguageGroupResultDTO.failure(groupId, "Language group with id " + groupId + " not found");
        }

        List<User> students = new ArrayList<>(
                userRepository.findByRoleAndGradeLevelOrderByIdAsc(UserRole.STUDENT, group.getGradeLevel()));
        List<Course> courses = new ArrayList<>(group.getCourses());
        List<Period> periods = new ArrayList<>(group.getPeriods());

        if (students.isEmpty()) {
            return LanguageGroupResultDTO.failure(groupId, "No students found in grade " + group.getGradeLevel());
        }
        if (courses.isEmpty()) {
            return LanguageGroupResultDTO.failure(groupId, "No courses found in language group " + group.getName());
        }
        if (periods.isEmpty()) {
            return LanguageGroupResultDTO.failure(groupId, "No periods found in language group " + group.getName());
        }
        String invalid = checkCourses(group, courses);
        if (invalid != null) {
            return LanguageGroupResultDTO.failure(groupId, invalid);
        }

        Collections.shuffle(students, distributionRandom.getObject());
        List<List<User>> shares = split(students, periods.size());

        // sections[course][period]
        List<List<Section>> sections = new ArrayList<>();
        for (int c = 0; c < courses.size(); c++) {
            List<Section> row = new ArrayList<>();
            for (Period period : periods) {
                Section section = sectionFor(courses.get(c), period, c + 1);
                section.clearEnrollment();
                row.add(section);
            }
            sections.add(row);
        }

        for (int c = 0; c < courses.size(); c++) {
            for (int p = 0; p < periods.size(); p++) {
                Section section = sections.get(c).get(p);
                int share = shares.get(p).size();
                if (share > section.getEffectiveCapacity()) {
                    return LanguageGroupResultDTO.failure(groupId, "Section " + section.getName() + " holds "
                            + section.getEffectiveCapacity() + " students but period " + periods.get(p).getName()
                            + " needs " + share);
                }
            }
        }

        for (int c = 0; c < courses.size(); c++) {
            Course course = courses.get(c);
            for (int p = 0; p < periods.size(); p++) {
                Section section = sections.get(c).get(p);
                section.setTrimester(c + 1);
                for (User student : shares.get(p)) {
                    section.enroll(student);
                    course.register(student);
                }
                log.debug("Enrolled {} students in section {} (period {}, trimester {})",
                        shares.get(p).size(), section.getName(), periods.get(p).getName(), c + 1);
            }
        }

        List<SectionRosterDTO> rosters = sections.stream()
                .flatMap(List::stream)
                .map(SectionRosterDTO::fromEntity)
                .toList();

        return LanguageGroupResultDTO.builder()
                .success(true)
                .groupId(group.getId())
                .groupName(group.getName())
                .gradeLevel(group.getGradeLevel())
                .totalStudents(students.size())
                .sections(rosters)
                .build();
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private String checkCourses(LanguageGroup group, List<Course> courses) {
        if (courses.size() > MAX_COURSES) {
            return "Language group " + group.getName() + " has " + courses.size()
                    + " courses but a year only has " + MAX_COURSES + " trimesters";
        }
        for (Course course : courses) {
            if (!course.isLanguage()) {
                return "Course " + course.getName() + " is not a language course";
            }
            if (course.getDuration() != CourseDuration.TRIMESTER) {
                return "Course " + course.getName() + " is not a trimester course";
            }
            if (!group.getGradeLevel().equals(course.getGradeLevel())) {
                return "Course " + course.getName() + " is for grade " + course.getGradeLevel()
                        + ", not grade " + group.getGradeLevel();
            }
        }
        return null;
    }

    /**
     * Split students into consecutive shares, one per period. The remainder goes
     * one student each to the first periods.
     */
    static <T> List<List<T>> split(List<T> students, int parts) {
        int base = students.size() / parts;
        int extra = students.size() % parts;
        List<List<T>> shares = new ArrayList<>(parts);
        int from = 0;
        for (int i = 0; i < parts; i++) {
            int size = base + (i < extra ? 1 : 0);
            shares.add(new ArrayList<>(students.subList(from, from + size)));
            from += size;
        }
        return shares;
    }

    private Section sectionFor(Course course, Period period, int trimester) {
        List<Section> existing = sectionRepository.findByCourse_IdAndPeriod_IdOrderBySectionNumberAsc(
                course.getId(), period.getId());
        if (!existing.isEmpty()) {
            return existing.get(0);
        }

        int number = sectionRepository.findMaxSectionNumber(course.getId()) + 1;
        Section section = Section.builder()
                .course(course)
                .sectionNumber(number)
                .period(period)
                .trimester(trimester)
                .build();
        log.info("Creating section {}-{} for period {}", course.getLabel(), number, period.getName());
        return sectionRepository.save(section);
    }
}
