package com.heronix.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.scheduler.config.SchedulerProperties;

/**
 * Heronix Scheduler - Course Section Distribution
 *
 * Places students registered for a course into that course's sections so that
 * nobody is double-booked in a period, sections stay balanced, and grouped
 * language courses rotate through the trimesters.
 *
 * Periods, rooms, teachers and sections are configured up front; the scheduler
 * only decides who sits in which section.
 */
@SpringBootApplication
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchedulerApplication.class, args);
    }
}
