package com.heronix.scheduler.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.scheduler.exception.ResourceNotFoundException;
import com.heronix.scheduler.exception.SchedulingValidationException;
import com.heronix.scheduler.model.domain.Room;
import com.heronix.scheduler.model.dto.RoomDTO;
import com.heronix.scheduler.model.dto.RoomRequestDTO;
import com.heronix.scheduler.repository.RoomRepository;
import com.heronix.scheduler.repository.SectionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private final RoomRepository roomRepository;
    private final SectionRepository sectionRepository;

    @Transactional(readOnly = true)
    public List<RoomDTO> listRooms() {
        return roomRepository.findAllByOrderByNameAsc().stream()
                .map(RoomDTO::fromEntity)
                .toList();
    }

    @Transactional
    public RoomDTO createRoom(RoomRequestDTO request) {
        if (roomRepository.existsByName(request.getName())) {
            throw new SchedulingValidationException("Room " + request.getName() + " already exists");
        }

        Room room = roomRepository.save(Room.builder()
                .name(request.getName())
                .capacity(request.getCapacity())
                .description(request.getDescription())
                .scienceLab(request.isScienceLab())
                .artRoom(request.isArtRoom())
                .gym(request.isGym())
                .build());

        log.info("Created room {} with capacity {}", room.getName(), room.getCapacity());
        return RoomDTO.fromEntity(room);
    }

    /**
     * Delete a room. Sections held in it keep existing without a room.
     */
    @Transactional
    public void deleteRoom(Long roomId) {
        Room room = roomRepository.findById(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));

        int detached = sectionRepository.clearRoom(roomId);
        roomRepository.deleteById(roomId);

        log.info("Deleted room {} ({} sections left without a room)", room.getName(), detached);
    }
}
