package dev.coursebuilder.exception;

import dev.coursebuilder.domain.entity.WorkRecordId;

/**
 * Thrown when a work record kept changing under every retry of a read-modify-write.
 */
public class ConcurrencyConflictException extends RuntimeException {
    private final WorkRecordId workRecordId;

    public ConcurrencyConflictException(WorkRecordId workRecordId, int attempts, Throwable cause) {
        super("Work record %s was modified concurrently; gave up after %d attempts"
                .formatted(workRecordId, attempts), cause);
        this.workRecordId = workRecordId;
    }

    public WorkRecordId getWorkRecordId() {
        return workRecordId;
    }
}
