package dev.coursebuilder.service;

import dev.coursebuilder.domain.entity.WorkRecord;
import java.util.List;
import java.util.Optional;

/**
 * Chooses which submission a reviewer gets next.
 *
 * <p>Candidates are already filtered: none belongs to the reviewer and none has the
 * reviewer on it, so an implementation only decides fairness.
 */
public interface ReviewerAssignmentStrategy {

    Optional<WorkRecord> choose(String reviewerId, List<WorkRecord> candidates);
}
