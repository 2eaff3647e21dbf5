package com.heronix.scheduler.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind of course offering.
 *
 * The order in which a full distribution run handles course types is configured
 * separately (see {@code heronix.scheduler.distribution.course-type-priority}).
 */
@Getter
@RequiredArgsConstructor
public enum CourseType {

    /**
     * Required course, every student of the grade is expected to take it
     */
    CORE("Core"),

    /**
     * Student picks one from a required set
     */
    REQUIRED_ELECTIVE("Required Elective"),

    /**
     * Optional course
     */
    ELECTIVE("Elective"),

    /**
     * Language course, usually distributed through a language group
     */
    LANGUAGE("Language");

    /**
     * Human readable label
     */
    private final String displayName;
}
