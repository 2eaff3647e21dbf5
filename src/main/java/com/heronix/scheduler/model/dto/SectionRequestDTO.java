package com.heronix.scheduler.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a section.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SectionRequestDTO {

    @NotNull(message = "Course ID is required")
    private Long courseId;

    /**
     * Optional. The next free number of the course is used when absent.
     */
    @Min(value = 1, message = "Section number must be at least 1")
    private Integer sectionNumber;

    @Min(value = 1, message = "Trimester must be between 1 and 3")
    @Max(value = 3, message = "Trimester must be between 1 and 3")
    private Integer trimester;

    @Min(value = 1, message = "Maximum students must be at least 1")
    private Integer maxStudents;

    private Long teacherId;
    private Long periodId;
    private Long roomId;
}
