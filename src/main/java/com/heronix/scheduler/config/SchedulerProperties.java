package com.heronix.scheduler.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.heronix.scheduler.model.enums.CourseType;

import lombok.Data;

/**
 * Configuration properties for Heronix Scheduler.
 */
@Data
@ConfigurationProperties(prefix = "heronix.scheduler")
public class SchedulerProperties {

    /**
     * Section distribution configuration
     */
    private DistributionConfig distribution = new DistributionConfig();

    /**
     * Bell schedule configuration
     */
    private PeriodConfig period = new PeriodConfig();

    @Data
    public static class DistributionConfig {
        /**
         * Seed for the random tiebreaks and the language group shuffle.
         * Leave unset for varied groupings between runs; set it to make runs reproducible.
         */
        private Long seed;

        /**
         * Order in which course types are distributed by a full run, hardest first.
         * Types missing from the list go last.
         */
        private List<CourseType> courseTypePriority = new ArrayList<>(List.of(
                CourseType.CORE,
                CourseType.REQUIRED_ELECTIVE,
                CourseType.ELECTIVE,
                CourseType.LANGUAGE));

        /**
         * Reason reported for students that could not be placed
         */
        private String unassignedReason = "Period conflicts or capacity constraints";

        public boolean isDeterministic() {
            return seed != null;
        }

        /**
         * Rank of a course type in the priority list (lower runs earlier).
         */
        public int priorityOf(CourseType courseType) {
            int index = courseTypePriority.indexOf(courseType);
            return index < 0 ? courseTypePriority.size() : index;
        }
    }

    @Data
    public static class PeriodConfig {
        /**
         * Shortest period accepted when periods are created
         */
        private int minDurationMinutes = 30;
    }
}
