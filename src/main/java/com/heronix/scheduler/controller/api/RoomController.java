package com.heronix.scheduler.controller.api;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.scheduler.model.dto.RoomDTO;
import com.heronix.scheduler.model.dto.RoomRequestDTO;
import com.heronix.scheduler.service.RoomService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/v1/scheduler/rooms")
@RequiredArgsConstructor
@Tag(name = "Rooms", description = "APIs for managing classrooms")
public class RoomController {

    private final RoomService roomService;

    @GetMapping
    @Operation(summary = "List rooms")
    public ResponseEntity<List<RoomDTO>> listRooms() {
        return ResponseEntity.ok(roomService.listRooms());
    }

    @PostMapping
    @Operation(summary = "Create room")
    @ApiResponse(responseCode = "201", description = "Room created")
    public ResponseEntity<RoomDTO> createRoom(@Valid @RequestBody RoomRequestDTO request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(roomService.createRoom(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete room", description = "Sections held in the room are left without a room")
    @ApiResponse(responseCode = "204", description = "Room deleted")
    public ResponseEntity<Void> deleteRoom(@PathVariable Long id) {
        roomService.deleteRoom(id);
        return ResponseEntity.noContent().build();
    }
}
