package com.heronix.scheduler.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.scheduler.model.domain.Section;

/**
 * Repository for Section entities.
 *
 * Besides plain lookups this holds the enrollment queries used by the conflict
 * checker and the post-distribution validations.
 */
@Repository
public interface SectionRepository extends JpaRepository<Section, Long> {

    List<Section> findByCourse_IdOrderBySectionNumberAsc(Long courseId);

    List<Section> findByCourse_IdAndPeriod_IdOrderBySectionNumberAsc(Long courseId, Long periodId);

    List<Section> findAllByOrderByCourse_IdAscSectionNumberAsc();

    long countByCourse_Id(Long courseId);

    boolean existsByCourse_IdAndSectionNumber(Long courseId, Integer sectionNumber);

    boolean existsByName(String name);

    @Query("SELECT COALESCE(MAX(s.sectionNumber), 0) FROM Section s WHERE s.course.id = :courseId")
    int findMaxSectionNumber(@Param("courseId") Long courseId);

    boolean existsByTeacher_IdAndPeriod_Id(Long teacherId, Long periodId);

    boolean existsByTeacher_IdAndPeriod_IdAndIdNot(Long teacherId, Long periodId, Long sectionId);

    boolean existsByRoom_IdAndPeriod_Id(Long roomId, Long periodId);

    boolean existsByRoom_IdAndPeriod_IdAndIdNot(Long roomId, Long periodId, Long sectionId);

    // ========================================================================
    // ENROLLMENT QUERIES
    // ========================================================================

    /**
     * True when the student sits in a section of another course that meets in the period.
     */
    @Query("SELECT COUNT(s) > 0 FROM Section s JOIN s.students st " +
           "WHERE st.id = :studentId AND s.period.id = :periodId AND s.course.id <> :courseId")
    boolean existsEnrollmentInPeriodOutsideCourse(
            @Param("studentId") Long studentId,
            @Param("periodId") Long periodId,
            @Param("courseId") Long courseId);

    /**
     * Current placements of the given students.
     * Returns [studentId, periodId, courseId]
     */
    @Query("SELECT st.id, s.period.id, s.course.id FROM Section s JOIN s.students st " +
           "WHERE st.id IN :studentIds AND s.period IS NOT NULL")
    List<Object[]> findPlacementsOfStudents(@Param("studentIds") Collection<Long> studentIds);

    /**
     * Distinct students of a grade enrolled in any section of a period.
     * Returns [periodId, periodName, count]
     */
    @Query("SELECT s.period.id, s.period.name, COUNT(DISTINCT st.id) FROM Section s JOIN s.students st " +
           "WHERE st.gradeLevel = :gradeLevel AND s.period IS NOT NULL " +
           "GROUP BY s.period.id, s.period.name")
    List<Object[]> countStudentsPerPeriodForGrade(@Param("gradeLevel") Integer gradeLevel);

    /**
     * Distinct students of a grade enrolled in the course.
     */
    @Query("SELECT COUNT(DISTINCT st.id) FROM Section s JOIN s.students st " +
           "WHERE s.course.id = :courseId AND st.gradeLevel = :gradeLevel")
    long countEnrolledInCourseForGrade(
            @Param("courseId") Long courseId,
            @Param("gradeLevel") Integer gradeLevel);

    /**
     * Distinct students enrolled in the course.
     */
    @Query("SELECT COUNT(DISTINCT st.id) FROM Section s JOIN s.students st WHERE s.course.id = :courseId")
    long countEnrolledInCourse(@Param("courseId") Long courseId);

    /**
     * Students enrolled in more than one course of the same exclusivity group.
     * Returns [groupName, studentId, username, courseCount]
     */
    @Query("SELECT c.courseGroup.name, st.id, st.username, COUNT(DISTINCT c.id) FROM Section s " +
           "JOIN s.course c JOIN s.students st WHERE c.courseGroup IS NOT NULL " +
           "GROUP BY c.courseGroup.name, st.id, st.username HAVING COUNT(DISTINCT c.id) > 1")
    List<Object[]> findExclusivityViolations();

    /**
     * Pairs of sections of different courses sharing a student and a period,
     * unless both run in different trimesters.
     * Returns [studentUsername, periodName, sectionName, sectionName]
     */
    @Query("SELECT st.username, a.period.name, a.name, b.name FROM Section a JOIN a.students st, Section b " +
           "WHERE st MEMBER OF b.students AND a.period = b.period AND a.id < b.id " +
           "AND a.course <> b.course " +
           "AND (a.trimester IS NULL OR b.trimester IS NULL OR a.trimester = b.trimester)")
    List<Object[]> findDoubleBookings();

    // ========================================================================
    // BULK UPDATES
    // ========================================================================

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Section s SET s.period = NULL WHERE s.period.id = :periodId")
    int clearPeriod(@Param("periodId") Long periodId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Section s SET s.room = NULL WHERE s.room.id = :roomId")
    int clearRoom(@Param("roomId") Long roomId);
}
