package com.heronix.scheduler.service.distribution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.dto.GradeLevelValidationDTO;
import com.heronix.scheduler.model.enums.CourseType;
import com.heronix.scheduler.model.enums.UserRole;
import com.heronix.scheduler.repository.CourseRepository;
import com.heronix.scheduler.repository.SectionRepository;
import com.heronix.scheduler.repository.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only checks over the current enrollment. Problems are reported, never corrected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DistributionValidationService {

    private final CourseRepository courseRepository;
    private final SectionRepository sectionRepository;
    private final UserRepository userRepository;

    /**
     * Validate every grade level that offers CORE courses.
     */
    public Map<Integer, GradeLevelValidationDTO> validateCoreGradeLevels() {
        Map<Integer, GradeLevelValidationDTO> results = new LinkedHashMap<>();
        for (Integer gradeLevel : courseRepository.findGradeLevelsWithCourseType(CourseType.CORE)) {
            results.put(gradeLevel, validateGradeLevel(gradeLevel));
        }
        return results;
    }

    /**
     * Check one grade level:
     * every CORE course of the grade enrolls the whole grade, and no period
     * holds more students of the grade than the grade has.
     */
    public GradeLevelValidationDTO validateGradeLevel(Integer gradeLevel) {
        long population = userRepository.countByRoleAndGradeLevel(UserRole.STUDENT, gradeLevel);
        List<String> errors = new ArrayList<>();

        for (Course course : courseRepository.findByCourseTypeAndGradeLevel(CourseType.CORE, gradeLevel)) {
            long enrolled = sectionRepository.countEnrolledInCourseForGrade(course.getId(), gradeLevel);
            if (enrolled != population) {
                errors.add("Required course " + course.getName() + " has " + enrolled
                        + " students enrolled, but grade " + gradeLevel + " has " + population + " total students");
            }
        }

        for (Object[] row : sectionRepository.countStudentsPerPeriodForGrade(gradeLevel)) {
            String periodName = (String) row[1];
            long count = ((Number) row[2]).longValue();
            if (count > population) {
                errors.add("Period " + periodName + " has " + count + " students from grade " + gradeLevel
                        + ", which exceeds the grade level total of " + population);
            }
        }

        if (!errors.isEmpty()) {
            log.error("Grade level {} validation failed: {}", gradeLevel, errors);
        }

        return GradeLevelValidationDTO.builder()
                .gradeLevel(gradeLevel)
                .studentCount(population)
                .errors(errors)
                .build();
    }

    /**
     * Courses whose enrolled head count misses their student-count requirement.
     */
    public List<String> checkStudentCountRequirements() {
        List<String> warnings = new ArrayList<>();
        for (Course course : courseRepository.findByStudentCountRequirement_TypeIsNotNullOrderByIdAsc()) {
            long enrolled = sectionRepository.countEnrolledInCourse(course.getId());
            long population = userRepository.countByRoleAndGradeLevel(UserRole.STUDENT, course.getGradeLevel());
            if (!course.getStudentCountRequirement().isSatisfiedBy(enrolled, population)) {
                warnings.add("Course " + course.getName() + " has " + enrolled
                        + " students enrolled, requirement is " + course.getStudentCountRequirement().describe());
            }
        }
        return warnings;
    }

    /**
     * Students enrolled in more than one course of the same course group.
     */
    public List<String> checkExclusiveGroups() {
        List<String> warnings = new ArrayList<>();
        for (Object[] row : sectionRepository.findExclusivityViolations()) {
            warnings.add("Student " + row[2] + " is enrolled in " + row[3]
                    + " courses of exclusive group " + row[0]);
        }
        return warnings;
    }

    /**
     * Students seated in two courses in the same period and trimester.
     */
    public List<String> checkDoubleBookings() {
        List<String> warnings = new ArrayList<>();
        for (Object[] row : sectionRepository.findDoubleBookings()) {
            warnings.add("Student " + row[0] + " is double-booked in period " + row[1]
                    + ": " + row[2] + " and " + row[3]);
        }
        return warnings;
    }

    /**
     * All enrollment warnings: count requirements, exclusive groups and double bookings.
     */
    public List<String> collectWarnings() {
        List<String> warnings = new ArrayList<>();
        warnings.addAll(checkStudentCountRequirements());
        warnings.addAll(checkExclusiveGroups());
        warnings.addAll(checkDoubleBookings());
        warnings.forEach(warning -> log.warn("Enrollment check: {}", warning));
        return warnings;
    }
}
