package com.heronix.scheduler.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClearResultDTO {

    private boolean success;

    /**
     * Null when every course was cleared.
     */
    private Long courseId;

    private int sectionsCleared;
    private int enrollmentsRemoved;
}
