package dev.coursebuilder.domain.valueobject;

import dev.coursebuilder.domain.entity.Answer;
import dev.coursebuilder.domain.entity.WorkRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Detached copy of a work record: the student's answers and the reviewer entries on them.
 */
public record StudentWork(String studentId, String unitId, List<Answer> submission,
                          Map<String, Reviewer> reviewers, Instant submittedAt) {

    public record Reviewer(String review, boolean draft, long dateAdded) {}

    public StudentWork {
        submission = List.copyOf(submission);
        reviewers = Map.copyOf(reviewers);
    }

    public static StudentWork of(WorkRecord record) {
        Map<String, Reviewer> reviewers = record.getReviewers().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> new Reviewer(
                        e.getValue().getReview(), e.getValue().isDraft(), e.getValue().getDateAdded())));
        return new StudentWork(record.getStudentId(), record.getUnitId(), record.getSubmission(),
                reviewers, record.getSubmittedAt());
    }

    /** The plain answer values in index order. */
    public List<String> answerValues() {
        return submission.stream().map(Answer::getValue).toList();
    }
}
