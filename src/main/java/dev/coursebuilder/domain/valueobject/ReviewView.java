package dev.coursebuilder.domain.valueobject;

import dev.coursebuilder.domain.entity.Answer;
import dev.coursebuilder.domain.entity.ReviewAssignment;
import dev.coursebuilder.domain.entity.WorkRecord;
import dev.coursebuilder.exception.ReviewerNotAssignedException;
import java.util.List;

/**
 * What a reviewer sees of one assigned submission.
 *
 * @param dateAdded UTC seconds since epoch at which the reviewer was assigned
 */
public record ReviewView(String studentId, String unitId, List<Answer> submission,
                         String review, boolean draft, long dateAdded) {
    public ReviewView {
        submission = List.copyOf(submission);
    }

    public static ReviewView of(WorkRecord record, String reviewerId) {
        ReviewAssignment assignment = record.getAssignment(reviewerId)
                .orElseThrow(() -> new ReviewerNotAssignedException(record.getId(), reviewerId));
        return new ReviewView(record.getStudentId(), record.getUnitId(), record.getSubmission(),
                assignment.getReview(), assignment.isDraft(), assignment.getDateAdded());
    }

    public boolean hasContent() {
        return review != null && !review.isBlank();
    }
}
