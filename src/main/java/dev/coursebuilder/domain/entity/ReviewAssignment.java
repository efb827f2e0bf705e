package dev.coursebuilder.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * A reviewer's slot on a work record. Content stays null until the reviewer
 * saves something; {@code dateAdded} is fixed at assignment time.
 */
@Embeddable
public class ReviewAssignment {

    public static final int MAX_REVIEW_LENGTH = 100_000;

    @Column(name = "review_content", length = MAX_REVIEW_LENGTH)
    private String review;

    @Column(name = "is_draft", nullable = false)
    private boolean draft;

    @Column(name = "date_added", nullable = false)
    private long dateAdded;

    protected ReviewAssignment() {
    }

    static ReviewAssignment assigned(long dateAdded) {
        ReviewAssignment a = new ReviewAssignment();
        a.review = null;
        a.draft = true;
        a.dateAdded = dateAdded;
        return a;
    }

    void record(String review, boolean draft) {
        this.review = review;
        this.draft = draft;
    }

    public String getReview() {
        return review;
    }

    public boolean isDraft() {
        return draft;
    }

    /** UTC seconds since epoch. */
    public long getDateAdded() {
        return dateAdded;
    }
}
