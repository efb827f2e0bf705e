package dev.coursebuilder.domain.entity;

import dev.coursebuilder.exception.InvalidInputException;
import dev.coursebuilder.exception.ReviewerNotAssignedException;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate root for one student's work on one unit: the submitted answers and
 * every reviewer assigned to them.
 *
 * Design: composite key instead of a concatenated string, optimistic locking
 * (@Version) so concurrent reviewer writes can't overwrite each other,
 * factory method for enforcing invariants on creation.
 */
@Entity
@Table(name = "work_records", indexes = {
        @Index(name = "idx_work_unit", columnList = "unit_id"),
        @Index(name = "idx_work_updated", columnList = "updated_at")
})
public class WorkRecord {

    /** Layout of the persisted record. Bump together with a new migration. */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    @EmbeddedId
    private WorkRecordId id;

    @ElementCollection
    @CollectionTable(name = "work_record_answers", joinColumns = {
            @JoinColumn(name = "student_id", referencedColumnName = "student_id"),
            @JoinColumn(name = "unit_id", referencedColumnName = "unit_id")
    })
    private List<Answer> submission = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "review_assignments", joinColumns = {
            @JoinColumn(name = "student_id", referencedColumnName = "student_id"),
            @JoinColumn(name = "unit_id", referencedColumnName = "unit_id")
    })
    @MapKeyColumn(name = "reviewer_id", length = WorkRecordId.MAX_STUDENT_ID_LENGTH)
    private Map<String, ReviewAssignment> reviewers = new HashMap<>();

    @Version
    private Long version;

    @Column(name = "schema_version", nullable = false)
    private int schemaVersion;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected WorkRecord() {
    }

    public static WorkRecord submit(WorkRecordId id, List<Answer> answers, Instant now) {
        WorkRecord w = new WorkRecord();
        w.id = id;
        w.schemaVersion = CURRENT_SCHEMA_VERSION;
        w.replaceSubmission(answers, now);
        return w;
    }

    /**
     * Replaces the answers and drops every reviewer. A resubmission is new
     * work, so reviews of the previous answers no longer apply.
     */
    public void replaceSubmission(List<Answer> answers, Instant now) {
        validateAnswers(answers);
        submission.clear();
        submission.addAll(answers);
        reviewers.clear();
        schemaVersion = CURRENT_SCHEMA_VERSION;
        submittedAt = now;
        updatedAt = now;
    }

    public void addReviewer(String reviewerId, Instant now) {
        WorkRecordId.requireId("reviewerId", reviewerId, WorkRecordId.MAX_STUDENT_ID_LENGTH);
        if (reviewerId.equals(id.getStudentId()))
            throw new InvalidInputException("Student %s cannot review their own work".formatted(reviewerId));
        reviewers.put(reviewerId, ReviewAssignment.assigned(now.getEpochSecond()));
        updatedAt = now;
    }

    public void recordReview(String reviewerId, String review, boolean draft, Instant now) {
        ReviewAssignment assignment = reviewers.get(reviewerId);
        if (assignment == null)
            throw new ReviewerNotAssignedException(id, reviewerId);
        if (!draft && (review == null || review.isBlank()))
            throw new InvalidInputException("A review cannot be finalized without content");
        if (review != null && review.length() > ReviewAssignment.MAX_REVIEW_LENGTH)
            throw new InvalidInputException("Review longer than %d characters".formatted(ReviewAssignment.MAX_REVIEW_LENGTH));
        assignment.record(review, draft);
        updatedAt = now;
    }

    public void removeReviewer(String reviewerId, Instant now) {
        if (reviewers.remove(reviewerId) == null)
            throw new ReviewerNotAssignedException(id, reviewerId);
        updatedAt = now;
    }

    public boolean hasReviewer(String reviewerId) {
        return reviewers.containsKey(reviewerId);
    }

    public Optional<ReviewAssignment> getAssignment(String reviewerId) {
        return Optional.ofNullable(reviewers.get(reviewerId));
    }

    public int getReviewerCount() {
        return reviewers.size();
    }

    static void validateAnswers(List<Answer> answers) {
        if (answers == null)
            throw new InvalidInputException("answers required");
        for (int i = 0; i < answers.size(); i++) {
            Answer a = answers.get(i);
            if (a == null || a.getIndex() != i)
                throw new InvalidInputException("Answer at position %d has index %s"
                        .formatted(i, a == null ? "null" : a.getIndex()));
            if (a.getValue() != null && a.getValue().length() > Answer.MAX_VALUE_LENGTH)
                throw new InvalidInputException("Answer %d longer than %d characters".formatted(i, Answer.MAX_VALUE_LENGTH));
        }
    }

    // Getters
    public WorkRecordId getId() {
        return id;
    }

    public String getStudentId() {
        return id.getStudentId();
    }

    public String getUnitId() {
        return id.getUnitId();
    }

    /** Answers in index order. */
    public List<Answer> getSubmission() {
        return submission.stream().sorted(Comparator.comparingInt(Answer::getIndex)).toList();
    }

    public Map<String, ReviewAssignment> getReviewers() {
        return Map.copyOf(reviewers);
    }

    public Long getVersion() {
        return version;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
