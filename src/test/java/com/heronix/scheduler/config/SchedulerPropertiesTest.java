package com.heronix.scheduler.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.heronix.scheduler.model.enums.CourseType;

class SchedulerPropertiesTest {

    @Test
    void defaultPriorityRunsCoreFirst() {
        SchedulerProperties.DistributionConfig config = new SchedulerProperties().getDistribution();

        assertThat(config.priorityOf(CourseType.CORE)).isZero();
        assertThat(config.priorityOf(CourseType.LANGUAGE)).isEqualTo(3);
        assertThat(config.isDeterministic()).isFalse();
    }

    @Test
    void unlistedTypesRunLast() {
        SchedulerProperties.DistributionConfig config = new SchedulerProperties.DistributionConfig();
        config.setCourseTypePriority(List.of(CourseType.ELECTIVE, CourseType.CORE));

        assertThat(config.priorityOf(CourseType.ELECTIVE)).isZero();
        assertThat(config.priorityOf(CourseType.LANGUAGE)).isEqualTo(2);
    }
}
