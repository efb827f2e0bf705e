package dev.coursebuilder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Course Builder peer review service.
 *
 * <p>Architecture overview:
 * <pre>
 * Student → SubmissionController → ReviewLifecycleService ─┐
 * Reviewer → ReviewController → ReviewAssignmentService ───┼→ WorkRecordWriter → [work_records]
 *                             → ReviewQueryService ────────┘   (versioned RMW, retried)
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>One versioned aggregate per (student, unit): submission and reviewer entries live together</li>
 *   <li>Optimistic locking plus bounded retry: concurrent assignments never lose reviewer entries</li>
 *   <li>Identity is passed explicitly into every service call, never looked up from shared state</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CourseBuilderReviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseBuilderReviewApplication.class, args);
    }
}
