package com.heronix.scheduler.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.scheduler.model.domain.User;
import com.heronix.scheduler.model.enums.UserRole;

/**
 * Repository for User entities.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUsername(String username);

    /**
     * Find all users of a role at a grade level, e.g. the students of grade 7.
     */
    List<User> findByRoleAndGradeLevelOrderByIdAsc(UserRole role, Integer gradeLevel);

    long countByRoleAndGradeLevel(UserRole role, Integer gradeLevel);

    /**
     * Student head count per grade level.
     * Returns [gradeLevel, count]
     */
    @Query("SELECT u.gradeLevel, COUNT(u) FROM User u WHERE u.role = :role AND u.gradeLevel IS NOT NULL " +
           "GROUP BY u.gradeLevel")
    List<Object[]> countByGradeLevel(@Param("role") UserRole role);
}
