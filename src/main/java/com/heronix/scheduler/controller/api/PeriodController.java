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

import com.heronix.scheduler.model.dto.PeriodDTO;
import com.heronix.scheduler.model.dto.PeriodRequestDTO;
import com.heronix.scheduler.service.PeriodService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * REST API for the bell schedule.
 */
@RestController
@RequestMapping("/api/v1/scheduler/periods")
@RequiredArgsConstructor
@Tag(name = "Periods", description = "APIs for managing class periods")
public class PeriodController {

    private final PeriodService periodService;

    @GetMapping
    @Operation(summary = "List periods", description = "All periods ordered by start time")
    public ResponseEntity<List<PeriodDTO>> listPeriods() {
        return ResponseEntity.ok(periodService.listPeriods());
    }

    @PostMapping
    @Operation(summary = "Create period")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Period created"),
        @ApiResponse(responseCode = "400", description = "Invalid, too short or overlapping period")
    })
    public ResponseEntity<PeriodDTO> createPeriod(@Valid @RequestBody PeriodRequestDTO request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(periodService.createPeriod(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete period", description = "Sections in the period are left without a period")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Period deleted"),
        @ApiResponse(responseCode = "404", description = "Period not found")
    })
    public ResponseEntity<Void> deletePeriod(@PathVariable Long id) {
        periodService.deletePeriod(id);
        return ResponseEntity.noContent().build();
    }
}
