package dev.coursebuilder.service;

import dev.coursebuilder.config.ReviewProperties;
import dev.coursebuilder.domain.entity.WorkRecordId;
import dev.coursebuilder.domain.enums.ReviewProgress;
import dev.coursebuilder.domain.valueobject.ReviewTally;
import dev.coursebuilder.domain.valueobject.ReviewView;
import dev.coursebuilder.domain.valueobject.StudentWork;
import dev.coursebuilder.repository.WorkRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class ReviewQueryService {
    private static final Comparator<ReviewView> BY_DATE_ADDED =
            Comparator.comparingLong(ReviewView::dateAdded).thenComparing(ReviewView::studentId);

    private final WorkRecordRepository repository;
    private final ReviewProperties properties;

    public ReviewQueryService(WorkRecordRepository repository, ReviewProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    /** The reviewer's assigned reviews on the unit, in the order they were assigned. */
    public List<ReviewView> getReviewsForReviewer(String reviewerId, String unitId) {
        return repository.findAllByUnitAndReviewer(unitId, reviewerId).stream()
                .filter(w -> w.hasReviewer(reviewerId))
                .map(w -> ReviewView.of(w, reviewerId))
                .sorted(BY_DATE_ADDED)
                .toList();
    }

    public Optional<StudentWork> getStudentWork(String studentId, String unitId) {
        return repository.findById(WorkRecordId.of(studentId, unitId)).map(StudentWork::of);
    }

    public ProgressReport getReviewProgress(String reviewerId, String unitId) {
        List<ReviewView> reviews = getReviewsForReviewer(reviewerId, unitId);
        int minimum = properties.minimumReviews(unitId);
        ReviewTally tally = ReviewTally.of(reviews);
        return new ProgressReport(unitId, minimum, tally, tally.progress(minimum), reviews);
    }

    public record ProgressReport(String unitId, int minimumRequired, ReviewTally tally,
                                 ReviewProgress progress, List<ReviewView> reviews) {}
}
