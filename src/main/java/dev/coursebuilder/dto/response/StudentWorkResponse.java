package dev.coursebuilder.dto.response;

import dev.coursebuilder.domain.valueobject.StudentWork;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * A student's own submission. Reviewer identities stay hidden; only finished reviews
 * are shown, oldest assignment first.
 */
public record StudentWorkResponse(String studentId, String unitId, List<String> answers,
                                  int reviewerCount, List<String> completedReviews, Instant submittedAt) {

    public static StudentWorkResponse from(StudentWork w) {
        List<String> completed = w.reviewers().values().stream()
                .filter(r -> !r.draft())
                .sorted(Comparator.comparingLong(StudentWork.Reviewer::dateAdded))
                .map(StudentWork.Reviewer::review)
                .toList();
        return new StudentWorkResponse(w.studentId(), w.unitId(), w.answerValues(),
                w.reviewers().size(), completed, w.submittedAt());
    }
}
