package com.heronix.scheduler.controller.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.scheduler.model.dto.BatchDistributionResultDTO;
import com.heronix.scheduler.model.dto.ClearResultDTO;
import com.heronix.scheduler.model.dto.DistributionResultDTO;
import com.heronix.scheduler.model.dto.DistributionStatusDTO;
import com.heronix.scheduler.model.dto.LanguageGroupResultDTO;
import com.heronix.scheduler.service.distribution.CourseDistributionService;
import com.heronix.scheduler.service.distribution.DistributionOrchestrationService;
import com.heronix.scheduler.service.distribution.LanguageGroupDistributionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for distributing registered students into sections.
 *
 * Distribution calls always answer 200 with a result body; whether the run
 * succeeded is reported in its {@code success} field.
 */
@RestController
@RequestMapping("/api/v1/scheduler/distribution")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Section Distribution", description = "APIs for assigning registered students to sections")
public class DistributionController {

    private final CourseDistributionService courseDistributionService;
    private final LanguageGroupDistributionService languageGroupDistributionService;
    private final DistributionOrchestrationService orchestrationService;

    @PostMapping("/courses/{courseId}")
    @Operation(summary = "Distribute a course",
               description = "Place the registered students of a course into its sections")
    @ApiResponse(responseCode = "200", description = "Distribution result")
    public ResponseEntity<DistributionResultDTO> distributeCourse(
            @Parameter(description = "Course ID") @PathVariable Long courseId) {

        log.info("Distribution requested for course {}", courseId);
        return ResponseEntity.ok(courseDistributionService.distributeCourse(courseId));
    }

    @PostMapping("/all")
    @Operation(summary = "Distribute everything",
               description = "Clear all enrollments, then distribute every language group and course")
    @ApiResponse(responseCode = "200", description = "Batch distribution result")
    public ResponseEntity<BatchDistributionResultDTO> distributeAll() {
        log.info("Full distribution requested");
        return ResponseEntity.ok(orchestrationService.distributeAll());
    }

    @PostMapping("/language-groups/{groupId}")
    @Operation(summary = "Distribute a language group",
               description = "Rotate every student of the group's grade through the group's courses")
    @ApiResponse(responseCode = "200", description = "Language group result")
    public ResponseEntity<LanguageGroupResultDTO> distributeLanguageGroup(
            @Parameter(description = "Language group ID") @PathVariable Long groupId) {

        log.info("Distribution requested for language group {}", groupId);
        return ResponseEntity.ok(languageGroupDistributionService.distributeLanguageGroup(groupId));
    }

    @DeleteMapping("/courses/{courseId}")
    @Operation(summary = "Clear a course", description = "Remove every enrollment from the course's sections")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Enrollments removed"),
        @ApiResponse(responseCode = "404", description = "Course not found")
    })
    public ResponseEntity<ClearResultDTO> clearCourse(
            @Parameter(description = "Course ID") @PathVariable Long courseId) {

        return ResponseEntity.ok(orchestrationService.clearCourse(courseId));
    }

    @DeleteMapping
    @Operation(summary = "Clear everything", description = "Remove every enrollment from every section")
    @ApiResponse(responseCode = "200", description = "Enrollments removed")
    public ResponseEntity<ClearResultDTO> clearAll() {
        return ResponseEntity.ok(orchestrationService.clearAll());
    }

    @GetMapping("/courses/{courseId}")
    @Operation(summary = "Distribution status", description = "Current rosters of a course's sections")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Status returned"),
        @ApiResponse(responseCode = "404", description = "Course not found")
    })
    public ResponseEntity<DistributionStatusDTO> getStatus(
            @Parameter(description = "Course ID") @PathVariable Long courseId) {

        return ResponseEntity.ok(orchestrationService.getStatus(courseId));
    }
}
