package com.heronix.scheduler.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.enums.CourseType;

/**
 * Repository for Course entities.
 */
@Repository
public interface CourseRepository extends JpaRepository<Course, Long> {

    List<Course> findByCourseTypeAndGradeLevel(CourseType courseType, Integer gradeLevel);

    /**
     * Grade levels that offer at least one course of the given type.
     */
    @Query("SELECT DISTINCT c.gradeLevel FROM Course c WHERE c.courseType = :type ORDER BY c.gradeLevel")
    List<Integer> findGradeLevelsWithCourseType(@Param("type") CourseType type);

    /**
     * Courses outside every language group that have at least one registered student.
     */
    @Query("SELECT c FROM Course c WHERE SIZE(c.registeredStudents) > 0 " +
           "AND NOT EXISTS (SELECT g FROM LanguageGroup g WHERE c MEMBER OF g.courses)")
    List<Course> findDistributableCourses();

    /**
     * Courses that carry a student-count requirement.
     */
    List<Course> findByStudentCountRequirement_TypeIsNotNullOrderByIdAsc();
}
