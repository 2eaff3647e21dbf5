package com.heronix.scheduler.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registered student the distributor could not place, with the reason.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UnassignedStudentDTO {

    private StudentSummaryDTO student;
    private String reason;
}
