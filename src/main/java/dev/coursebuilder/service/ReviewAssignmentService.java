package dev.coursebuilder.service;

import dev.coursebuilder.domain.entity.WorkRecord;
import dev.coursebuilder.domain.entity.WorkRecordId;
import dev.coursebuilder.domain.valueobject.ReviewView;
import dev.coursebuilder.infrastructure.persistence.WorkRecordWriter;
import dev.coursebuilder.repository.WorkRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Pairs reviewers with submissions and manages reviewer entries.
 *
 * <p>NOT @Transactional: every write goes through {@link WorkRecordWriter}, which
 * scopes one transaction per attempt. The candidate scan is a plain read and may be
 * stale by the time the write happens; the write itself is still safe.
 */
@Service
public class ReviewAssignmentService {
    private static final Logger log = LoggerFactory.getLogger(ReviewAssignmentService.class);

    private final WorkRecordRepository repository;
    private final WorkRecordWriter writer;
    private final ReviewerAssignmentStrategy strategy;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public ReviewAssignmentService(WorkRecordRepository repository, WorkRecordWriter writer,
                                   ReviewerAssignmentStrategy strategy, Clock clock,
                                   MeterRegistry meterRegistry) {
        this.repository = repository;
        this.writer = writer;
        this.strategy = strategy;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Returns the student whose work {@code reviewerId} should review next, or empty
     * when every submission of the unit is the reviewer's own or already theirs.
     */
    public Optional<String> assignNextSubmission(String reviewerId, String unitId) {
        List<WorkRecord> candidates = repository.findAllByUnit(unitId).stream()
                .filter(w -> w.getUnitId().equals(unitId))
                .filter(w -> !w.hasReviewer(reviewerId))
                .filter(w -> !w.getStudentId().equals(reviewerId))
                .toList();
        Optional<String> chosen = strategy.choose(reviewerId, candidates).map(WorkRecord::getStudentId);
        log.debug("Next submission for reviewer {} on unit {}: {} ({} candidates)",
                reviewerId, unitId, chosen.orElse("none"), candidates.size());
        return chosen;
    }

    /**
     * Picks the next submission for the reviewer and assigns them to it.
     * A duplicate request that finds the reviewer already on the chosen record gets
     * the existing assignment back unchanged.
     */
    public Optional<ReviewView> assignReviewer(String reviewerId, String unitId) {
        Optional<String> studentId = assignNextSubmission(reviewerId, unitId);
        if (studentId.isEmpty()) {
            meterRegistry.counter("coursebuilder.review.assignments", "outcome", "none").increment();
            log.info("No submission available for reviewer {} on unit {}", reviewerId, unitId);
            return Optional.empty();
        }
        ReviewView view = writer.update(WorkRecordId.of(studentId.get(), unitId),
                record -> {
                    if (!record.hasReviewer(reviewerId)) record.addReviewer(reviewerId, clock.instant());
                },
                record -> ReviewView.of(record, reviewerId));
        meterRegistry.counter("coursebuilder.review.assignments", "outcome", "assigned").increment();
        log.info("Assigned reviewer {} to work of {} on unit {}", reviewerId, studentId.get(), unitId);
        return Optional.of(view);
    }

    /** Assigns {@code reviewerId} to the student's work, replacing any earlier entry of theirs. */
    public ReviewView addReviewer(String studentId, String unitId, String reviewerId) {
        ReviewView view = writer.update(WorkRecordId.of(studentId, unitId),
                record -> record.addReviewer(reviewerId, clock.instant()),
                record -> ReviewView.of(record, reviewerId));
        log.info("Added reviewer {} to work of {} on unit {}", reviewerId, studentId, unitId);
        return view;
    }

    public void removeReviewer(String studentId, String unitId, String reviewerId) {
        writer.update(WorkRecordId.of(studentId, unitId),
                record -> record.removeReviewer(reviewerId, clock.instant()),
                WorkRecord::getReviewerCount);
        log.info("Removed reviewer {} from work of {} on unit {}", reviewerId, studentId, unitId);
    }
}
