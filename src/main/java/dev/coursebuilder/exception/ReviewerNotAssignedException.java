package dev.coursebuilder.exception;

import dev.coursebuilder.domain.entity.WorkRecordId;

/**
 * Thrown when a reviewer acts on a submission they were never assigned to.
 */
public class ReviewerNotAssignedException extends NotFoundException {
    private final WorkRecordId workRecordId;
    private final String reviewerId;

    public ReviewerNotAssignedException(WorkRecordId workRecordId, String reviewerId) {
        super("Reviewer %s is not assigned to the work of %s for unit %s"
                .formatted(reviewerId, workRecordId.getStudentId(), workRecordId.getUnitId()));
        this.workRecordId = workRecordId;
        this.reviewerId = reviewerId;
    }

    public WorkRecordId getWorkRecordId() {
        return workRecordId;
    }

    public String getReviewerId() {
        return reviewerId;
    }
}
