package dev.coursebuilder.domain.entity;

import dev.coursebuilder.exception.InvalidInputException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key of a work record: the submitting student and the assessment unit.
 */
@Embeddable
public class WorkRecordId implements Serializable {

    /** Column widths of the key; student ids share theirs with reviewer ids. */
    public static final int MAX_STUDENT_ID_LENGTH = 255;
    public static final int MAX_UNIT_ID_LENGTH = 64;

    @Column(name = "student_id", nullable = false, length = MAX_STUDENT_ID_LENGTH)
    private String studentId;

    @Column(name = "unit_id", nullable = false, length = MAX_UNIT_ID_LENGTH)
    private String unitId;

    protected WorkRecordId() {
    }

    private WorkRecordId(String studentId, String unitId) {
        this.studentId = studentId;
        this.unitId = unitId;
    }

    public static WorkRecordId of(String studentId, String unitId) {
        return new WorkRecordId(
                requireId("studentId", studentId, MAX_STUDENT_ID_LENGTH),
                requireId("unitId", unitId, MAX_UNIT_ID_LENGTH));
    }

    static String requireId(String name, String value, int maxLength) {
        if (value == null || value.isBlank())
            throw new InvalidInputException(name + " required");
        if (value.length() > maxLength)
            throw new InvalidInputException("%s longer than %d characters".formatted(name, maxLength));
        return value;
    }

    public String getStudentId() {
        return studentId;
    }

    public String getUnitId() {
        return unitId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkRecordId other)) return false;
        return studentId.equals(other.studentId) && unitId.equals(other.unitId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(studentId, unitId);
    }

    @Override
    public String toString() {
        return "(work:%s:%s)".formatted(unitId, studentId);
    }
}
