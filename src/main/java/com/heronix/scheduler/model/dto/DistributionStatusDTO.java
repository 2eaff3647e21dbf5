package com.heronix.scheduler.model.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current enrollment of a course's sections.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DistributionStatusDTO {

    private Long courseId;
    private String courseName;
    private int registeredCount;
    private int enrolledCount;

    /**
     * True when any section holds at least one student.
     */
    private boolean distributed;

    private List<SectionRosterDTO> sections;
}
