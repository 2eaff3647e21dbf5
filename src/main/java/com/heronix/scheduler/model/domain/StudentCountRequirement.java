package com.heronix.scheduler.model.domain;

import com.heronix.scheduler.model.enums.StudentCountRequirementType;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Head count a course is expected to reach once distributed.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StudentCountRequirement {

    @Enumerated(EnumType.STRING)
    @Column(name = "count_requirement", length = 12)
    private StudentCountRequirementType type;

    /**
     * Compared against the enrolled count for EXACT, MIN and MAX.
     */
    @Min(0)
    @Column(name = "count_requirement_value")
    private Integer count;

    public boolean isSatisfiedBy(long enrolled, long gradePopulation) {
        if (type == null) {
            return true;
        }
        return type.isSatisfiedBy(enrolled, count != null ? count : 0, gradePopulation);
    }

    public String describe() {
        if (type == null) {
            return "none";
        }
        return type == StudentCountRequirementType.FULL_GRADE ? type.name() : type.name() + " " + count;
    }
}
