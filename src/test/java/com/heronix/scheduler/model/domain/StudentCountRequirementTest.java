package com.heronix.scheduler.model.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.heronix.scheduler.model.enums.StudentCountRequirementType;

class StudentCountRequirementTest {

    @Test
    void checksEachRequirementType() {
        assertThat(new StudentCountRequirement(StudentCountRequirementType.FULL_GRADE, null).isSatisfiedBy(40, 40)).isTrue();
        assertThat(new StudentCountRequirement(StudentCountRequirementType.FULL_GRADE, null).isSatisfiedBy(39, 40)).isFalse();
        assertThat(new StudentCountRequirement(StudentCountRequirementType.EXACT, 20).isSatisfiedBy(20, 40)).isTrue();
        assertThat(new StudentCountRequirement(StudentCountRequirementType.MIN, 20).isSatisfiedBy(19, 40)).isFalse();
        assertThat(new StudentCountRequirement(StudentCountRequirementType.MAX, 20).isSatisfiedBy(19, 40)).isTrue();
    }

    @Test
    void missingTypeIsAlwaysSatisfied() {
        assertThat(new StudentCountRequirement().isSatisfiedBy(0, 40)).isTrue();
        assertThat(new StudentCountRequirement().describe()).isEqualTo("none");
    }
}
