package com.heronix.scheduler.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.scheduler.model.domain.CourseGroup;

/**
 * Repository for CourseGroup entities.
 */
@Repository
public interface CourseGroupRepository extends JpaRepository<CourseGroup, Long> {

    Optional<CourseGroup> findByName(String name);
}
