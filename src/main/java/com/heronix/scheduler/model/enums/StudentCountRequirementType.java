package com.heronix.scheduler.model.enums;

/**
 * How the enrolled head count of a course is checked after distribution.
 */
public enum StudentCountRequirementType {

    /**
     * Every student of the course's grade level must be enrolled
     */
    FULL_GRADE,

    /**
     * Enrolled count must equal the configured count
     */
    EXACT,

    /**
     * Enrolled count must be at least the configured count
     */
    MIN,

    /**
     * Enrolled count must not exceed the configured count
     */
    MAX;

    /**
     * Check an enrolled count against this requirement.
     *
     * @param enrolled        students enrolled in the course
     * @param count           the configured count (ignored for FULL_GRADE)
     * @param gradePopulation students in the course's grade level
     */
    public boolean isSatisfiedBy(long enrolled, int count, long gradePopulation) {
        return switch (this) {
            case FULL_GRADE -> enrolled == gradePopulation;
            case EXACT -> enrolled == count;
            case MIN -> enrolled >= count;
            case MAX -> enrolled <= count;
        };
    }
}
