package com.heronix.scheduler.model.dto;

import com.heronix.scheduler.model.domain.Room;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoomDTO {

    private Long id;
    private String name;
    private Integer capacity;
    private String description;
    private boolean scienceLab;
    private boolean artRoom;
    private boolean gym;

    public static RoomDTO fromEntity(Room room) {
        return RoomDTO.builder()
                .id(room.getId())
                .name(room.getName())
                .capacity(room.getCapacity())
                .description(room.getDescription())
                .scienceLab(room.isScienceLab())
                .artRoom(room.isArtRoom())
                .gym(room.isGym())
                .build();
    }
}
