package dev.coursebuilder.service;

import dev.coursebuilder.domain.entity.WorkRecord;
import org.springframework.stereotype.Component;
import java.util.List;
import java.util.Optional;

/**
 * Greedy load balancing: the candidate with the fewest reviewers wins, the first one
 * in scan order on a tie. Not globally optimal; a linear pass over the unit.
 */
@Component
public class LeastLoadedAssignmentStrategy implements ReviewerAssignmentStrategy {

    @Override
    public Optional<WorkRecord> choose(String reviewerId, List<WorkRecord> candidates) {
        WorkRecord chosen = null;
        for (WorkRecord candidate : candidates) {
            if (chosen == null || candidate.getReviewerCount() < chosen.getReviewerCount()) {
                chosen = candidate;
            }
        }
        return Optional.ofNullable(chosen);
    }
}
