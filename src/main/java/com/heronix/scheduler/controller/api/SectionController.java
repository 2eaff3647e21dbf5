package com.heronix.scheduler.controller.api;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.scheduler.model.dto.SectionDTO;
import com.heronix.scheduler.model.dto.SectionRequestDTO;
import com.heronix.scheduler.service.SectionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for course sections.
 */
@RestController
@RequestMapping("/api/v1/scheduler/sections")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Sections", description = "APIs for managing course sections")
public class SectionController {

    private final SectionService sectionService;

    @GetMapping
    @Operation(summary = "List sections", description = "All sections, or the sections of one course")
    public ResponseEntity<List<SectionDTO>> listSections(
            @Parameter(description = "Restrict to one course") @RequestParam(required = false) Long courseId) {
        return ResponseEntity.ok(sectionService.listSections(courseId));
    }

    @PostMapping
    @Operation(summary = "Create section")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Section created"),
        @ApiResponse(responseCode = "400", description = "Trimester rule or period booking violated"),
        @ApiResponse(responseCode = "404", description = "Course, teacher, period or room not found")
    })
    public ResponseEntity<SectionDTO> createSection(@Valid @RequestBody SectionRequestDTO request) {
        log.info("Creating section for course {}", request.getCourseId());
        return ResponseEntity.status(HttpStatus.CREATED).body(sectionService.createSection(request));
    }

    @PutMapping("/{id}/period/{periodId}")
    @Operation(summary = "Assign period", description = "Move a section to another period")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Section moved"),
        @ApiResponse(responseCode = "400", description = "Teacher or room already booked in the period"),
        @ApiResponse(responseCode = "404", description = "Section or period not found")
    })
    public ResponseEntity<SectionDTO> assignPeriod(@PathVariable Long id, @PathVariable Long periodId) {
        return ResponseEntity.ok(sectionService.assignPeriod(id, periodId));
    }
}
