package dev.coursebuilder.exception;

import dev.coursebuilder.domain.entity.WorkRecordId;

public class WorkRecordNotFoundException extends NotFoundException {
    private final WorkRecordId workRecordId;

    public WorkRecordNotFoundException(WorkRecordId workRecordId) {
        super("No work submitted by %s for unit %s"
                .formatted(workRecordId.getStudentId(), workRecordId.getUnitId()));
        this.workRecordId = workRecordId;
    }

    public WorkRecordId getWorkRecordId() {
        return workRecordId;
    }
}
