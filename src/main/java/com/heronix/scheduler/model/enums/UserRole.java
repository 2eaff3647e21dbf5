package com.heronix.scheduler.model.enums;

/**
 * Role of a user account.
 */
public enum UserRole {

    ADMIN,

    /**
     * May be assigned to sections as their teacher
     */
    TEACHER,

    /**
     * May be registered for courses and enrolled in sections
     */
    STUDENT
}
