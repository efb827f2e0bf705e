package dev.coursebuilder.domain.enums;

/**
 * A reviewer's progress on a unit: NOT_STARTED → IN_PROGRESS → COMPLETED
 */
public enum ReviewProgress {
    NOT_STARTED, IN_PROGRESS, COMPLETED
}
