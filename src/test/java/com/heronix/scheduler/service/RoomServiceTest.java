package com.heronix.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import com.heronix.scheduler.SchedulerTestData;
import com.heronix.scheduler.exception.SchedulingValidationException;
import com.heronix.scheduler.model.domain.Course;
import com.heronix.scheduler.model.domain.Room;
import com.heronix.scheduler.model.domain.Section;
import com.heronix.scheduler.model.dto.RoomDTO;
import com.heronix.scheduler.model.dto.RoomRequestDTO;
import com.heronix.scheduler.repository.RoomRepository;
import com.heronix.scheduler.repository.SectionRepository;

@SpringBootTest
@Import(SchedulerTestData.class)
class RoomServiceTest {

    @Autowired
    private RoomService roomService;

    @Autowired
    private SchedulerTestData data;

    @Autowired
    private RoomRepository roomRepository;

    @Autowired
    private SectionRepository sectionRepository;

    @BeforeEach
    void setUp() {
        data.reset();
    }

    @Test
    void createsRoomWithFacilityFlags() {
        RoomDTO lab = roomService.createRoom(RoomRequestDTO.builder()
                .name("Lab 2")
                .capacity(24)
                .scienceLab(true)
                .build());

        assertThat(lab.getId()).isNotNull();
        assertThat(lab.isScienceLab()).isTrue();
        assertThat(lab.isGym()).isFalse();
        assertThat(roomService.listRooms()).extracting(RoomDTO::getName).containsExactly("Lab 2");
    }

    @Test
    void rejectsDuplicateName() {
        data.room("Room 101", 30);

        assertThatThrownBy(() -> roomService.createRoom(RoomRequestDTO.builder().name("Room 101").capacity(20).build()))
                .isInstanceOf(SchedulingValidationException.class);
    }

    @Test
    void deletingRoomDetachesItsSections() {
        Room room = data.room("Room 101", 30);
        Course english = data.coreCourse("ENG6", 6, List.of());
        Section section = data.section(english, 1, null, null);
        section.setRoom(room);
        sectionRepository.save(section);

        roomService.deleteRoom(room.getId());

        assertThat(roomRepository.count()).isZero();
        List<Section> remaining = sectionRepository.findByCourse_IdOrderBySectionNumberAsc(english.getId());
        assertThat(remaining).hasSize(1);
        assertThat(remaining.get(0).getRoom()).isNull();
    }
}
