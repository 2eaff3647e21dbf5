package com.heronix.scheduler.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.scheduler.model.domain.Room;

/**
 * Repository for Room entities.
 */
@Repository
public interface RoomRepository extends JpaRepository<Room, Long> {

    List<Room> findAllByOrderByNameAsc();

    boolean existsByName(String name);
}
