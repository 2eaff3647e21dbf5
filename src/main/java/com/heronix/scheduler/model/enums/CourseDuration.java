package com.heronix.scheduler.model.enums;

/**
 * How long a course runs within the school year.
 */
public enum CourseDuration {

    QUARTER,

    /**
     * One of three sub-terms. Sections of trimester courses must name their trimester.
     */
    TRIMESTER,

    /**
     * Full year. Sections of year-long courses carry no trimester.
     */
    YEAR
}
