package dev.coursebuilder.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.util.Objects;

/** One answer of a submission, tagged with its zero-based position. */
@Embeddable
public class Answer {

    public static final int MAX_VALUE_LENGTH = 100_000;

    @Column(name = "answer_index", nullable = false)
    private int index;

    @Column(name = "answer_value", length = MAX_VALUE_LENGTH)
    private String value;

    protected Answer() {
    }

    public Answer(int index, String value) {
        this.index = index;
        this.value = value;
    }

    public int getIndex() {
        return index;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Answer other)) return false;
        return index == other.index && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, value);
    }
}
