package com.heronix.scheduler.model.dto;

import com.heronix.scheduler.model.domain.User;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Student as listed on rosters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentSummaryDTO {

    private Long id;
    private String username;
    private String fullName;
    private Integer gradeLevel;

    public static StudentSummaryDTO fromEntity(User student) {
        return StudentSummaryDTO.builder()
                .id(student.getId())
                .username(student.getUsername())
                .fullName(student.getFullName())
                .gradeLevel(student.getGradeLevel())
                .build();
    }
}
