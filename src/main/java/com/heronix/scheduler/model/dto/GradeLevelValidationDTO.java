package com.heronix.scheduler.model.dto;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Post-distribution checks for one grade level.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GradeLevelValidationDTO {

    private Integer gradeLevel;

    /**
     * Students in the grade.
     */
    private long studentCount;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean isValid() {
        return errors.isEmpty();
    }
}
