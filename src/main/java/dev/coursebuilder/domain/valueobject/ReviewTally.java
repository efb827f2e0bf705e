package dev.coursebuilder.domain.valueobject;

import dev.coursebuilder.domain.enums.ReviewProgress;
import java.util.List;

/**
 * Counts over a reviewer's assigned reviews for one unit, and the progress they imply.
 * Pure: it looks at nothing but the views it was built from.
 */
public record ReviewTally(int assignedCount, int completedCount, boolean hasUnstarted, boolean hasCompletedAll) {

    public static ReviewTally of(List<ReviewView> reviews) {
        int completed = 0;
        boolean unstarted = false;
        boolean completedAll = true;
        for (ReviewView review : reviews) {
            if (!review.draft()) completed++;
            if (!review.hasContent()) {
                unstarted = true;
                completedAll = false;
            }
            if (review.draft()) completedAll = false;
        }
        return new ReviewTally(reviews.size(), completed, unstarted, completedAll);
    }

    public boolean hasCompletedEnough(int minimumRequired) {
        return completedCount >= minimumRequired;
    }

    public ReviewProgress progress(int minimumRequired) {
        if (hasCompletedEnough(minimumRequired)) return ReviewProgress.COMPLETED;
        if (completedCount > 0) return ReviewProgress.IN_PROGRESS;
        return ReviewProgress.NOT_STARTED;
    }
}
