package com.heronix.scheduler.model.dto;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of distributing the registered students of one course.
 *
 * A run that placed only part of the students is still a success; the
 * remaining students are listed in {@code unassignedStudents}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DistributionResultDTO {

    private boolean success;

    /**
     * Why the run failed; null on success.
     */
    private String error;

    private Long courseId;
    private String courseName;
    private String courseCode;

    /**
     * Registered students considered by the run.
     */
    private int totalStudents;

    private int numSections;

    @Builder.Default
    private List<SectionRosterDTO> distribution = new ArrayList<>();

    @Builder.Default
    private List<UnassignedStudentDTO> unassignedStudents = new ArrayList<>();

    public static DistributionResultDTO failure(Long courseId, String error) {
        return DistributionResultDTO.builder()
                .success(false)
                .courseId(courseId)
                .error(error)
                .build();
    }

    public int getAssignedCount() {
        return distribution.stream().mapToInt(SectionRosterDTO::getEnrolledCount).sum();
    }
}
