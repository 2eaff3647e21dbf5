package com.heronix.scheduler.model.dto;

import java.util.Comparator;
import java.util.List;

import com.heronix.scheduler.model.domain.Section;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A section with the students enrolled in it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SectionRosterDTO {

    private Long sectionId;
    private String sectionName;
    private Integer sectionNumber;
    private Long periodId;
    private String periodName;
    private Integer trimester;

    /**
     * Effective capacity of the section.
     */
    private int capacity;

    private int enrolledCount;
    private List<StudentSummaryDTO> students;

    /**
     * Create from entity. Must be called while the section's associations can still be loaded.
     */
    public static SectionRosterDTO fromEntity(Section section) {
        List<StudentSummaryDTO> students = section.getStudents().stream()
                .map(StudentSummaryDTO::fromEntity)
                .sorted(Comparator.comparing(StudentSummaryDTO::getUsername))
                .toList();

        return SectionRosterDTO.builder()
                .sectionId(section.getId())
                .sectionName(section.getName())
                .sectionNumber(section.getSectionNumber())
                .periodId(section.getPeriod() != null ? section.getPeriod().getId() : null)
                .periodName(section.getPeriod() != null ? section.getPeriod().getName() : null)
                .trimester(section.getTrimester())
                .capacity(section.getEffectiveCapacity())
                .enrolledCount(students.size())
                .students(students)
                .build();
    }
}
