package com.heronix.scheduler.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.scheduler.model.domain.LanguageGroup;

/**
 * Repository for LanguageGroup entities.
 */
@Repository
public interface LanguageGroupRepository extends JpaRepository<LanguageGroup, Long> {

    List<LanguageGroup> findAllByOrderByGradeLevelAscIdAsc();

    /**
     * Check whether a course is part of any language group.
     */
    @Query("SELECT COUNT(g) > 0 FROM LanguageGroup g JOIN g.courses c WHERE c.id = :courseId")
    boolean existsByCourseId(@Param("courseId") Long courseId);
}
