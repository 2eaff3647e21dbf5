package com.heronix.scheduler.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.scheduler.model.domain.Period;

/**
 * Repository for Period entities.
 */
@Repository
public interface PeriodRepository extends JpaRepository<Period, Long> {

    List<Period> findAllByOrderByStartTimeAsc();

    Optional<Period> findByName(String name);

    boolean existsByName(String name);
}
