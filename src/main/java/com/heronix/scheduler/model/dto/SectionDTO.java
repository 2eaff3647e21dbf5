package com.heronix.scheduler.model.dto;

import com.heronix.scheduler.model.domain.Section;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Section as shown by the section endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SectionDTO {

    private Long id;
    private String name;
    private Long courseId;
    private String courseName;
    private Integer sectionNumber;
    private Integer trimester;
    private Integer maxStudents;
    private int effectiveCapacity;
    private Long teacherId;
    private String teacherName;
    private Long periodId;
    private String periodName;
    private Long roomId;
    private String roomName;
    private int enrolledCount;

    public static SectionDTO fromEntity(Section section) {
        return SectionDTO.builder()
                .id(section.getId())
                .name(section.getName())
                .courseId(section.getCourse().getId())
                .courseName(section.getCourse().getName())
                .sectionNumber(section.getSectionNumber())
                .trimester(section.getTrimester())
                .maxStudents(section.getMaxStudents())
                .effectiveCapacity(section.getEffectiveCapacity())
                .teacherId(section.getTeacher() != null ? section.getTeacher().getId() : null)
                .teacherName(section.getTeacher() != null ? section.getTeacher().getFullName() : null)
                .periodId(section.getPeriod() != null ? section.getPeriod().getId() : null)
                .periodName(section.getPeriod() != null ? section.getPeriod().getName() : null)
                .roomId(section.getRoom() != null ? section.getRoom().getId() : null)
                .roomName(section.getRoom() != null ? section.getRoom().getName() : null)
                .enrolledCount(section.getEnrolledCount())
                .build();
    }
}
