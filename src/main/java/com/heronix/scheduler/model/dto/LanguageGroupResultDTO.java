package com.heronix.scheduler.model.dto;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of distributing a grade across the courses and periods of a language group.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LanguageGroupResultDTO {

    private boolean success;
    private String error;
    private Long groupId;
    private String groupName;
    private Integer gradeLevel;
    private int totalStudents;

    /**
     * Every (course, period) section of the group, in course then period order.
     */
    @Builder.Default
    private List<SectionRosterDTO> sections = new ArrayList<>();

    public static LanguageGroupResultDTO failure(Long groupId, String error) {
        return LanguageGroupResultDTO.builder()
                .success(false)
                .groupId(groupId)
                .error(error)
                .build();
    }
}
