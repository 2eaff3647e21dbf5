package com.heronix.scheduler.model.dto;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a full distribution run over every language group and course.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchDistributionResultDTO {

    private boolean success;

    /**
     * Set when the run stopped before distributing anything.
     */
    private String error;

    /**
     * Results keyed by language group id, in processing order.
     */
    @Builder.Default
    private Map<Long, LanguageGroupResultDTO> languageGroups = new LinkedHashMap<>();

    /**
     * Results keyed by course id, in processing order.
     */
    @Builder.Default
    private Map<Long, DistributionResultDTO> courses = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, GradeLevelValidationDTO> gradeLevelValidation = new LinkedHashMap<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
