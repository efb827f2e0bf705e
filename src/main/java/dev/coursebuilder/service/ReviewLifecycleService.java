package dev.coursebuilder.service;

import dev.coursebuilder.domain.entity.Answer;
import dev.coursebuilder.domain.entity.WorkRecord;
import dev.coursebuilder.domain.entity.WorkRecordId;
import dev.coursebuilder.domain.valueobject.ReviewView;
import dev.coursebuilder.domain.valueobject.StudentWork;
import dev.coursebuilder.infrastructure.persistence.WorkRecordWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Command-side service for submissions and reviews. Each call is one retried
 * read-modify-write of a single work record.
 */
@Service
public class ReviewLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(ReviewLifecycleService.class);
    private final WorkRecordWriter writer;
    private final Clock clock;

    public ReviewLifecycleService(WorkRecordWriter writer, Clock clock) {
        this.writer = writer;
        this.clock = clock;
    }

    /**
     * Puts the student's answers into the review pool. A resubmission replaces the
     * previous answers and drops their reviewers.
     */
    public StudentWork submitWork(String studentId, String unitId, List<Answer> answers) {
        WorkRecordId id = WorkRecordId.of(studentId, unitId);
        StudentWork work = writer.upsert(id,
                () -> WorkRecord.submit(id, answers, clock.instant()),
                existing -> existing.replaceSubmission(answers, clock.instant()),
                StudentWork::of);
        log.info("Student {} submitted {} answers for unit {}", studentId, answers.size(), unitId);
        return work;
    }

    /**
     * Saves the reviewer's review of the student's work. The reviewer must already be
     * assigned; a final (non-draft) review must have content.
     */
    public ReviewView submitReview(String studentId, String unitId, String reviewerId,
                                   String review, boolean draft) {
        ReviewView view = writer.update(WorkRecordId.of(studentId, unitId),
                record -> record.recordReview(reviewerId, review, draft, clock.instant()),
                record -> ReviewView.of(record, reviewerId));
        log.info("Reviewer {} saved {} review of {} on unit {}",
                reviewerId, draft ? "draft" : "final", studentId, unitId);
        return view;
    }
}
