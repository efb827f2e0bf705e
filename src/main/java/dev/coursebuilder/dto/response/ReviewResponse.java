package dev.coursebuilder.dto.response;

import dev.coursebuilder.domain.entity.Answer;
import dev.coursebuilder.domain.valueobject.ReviewView;
import java.time.Instant;
import java.util.List;

public record ReviewResponse(String studentId, String unitId, List<String> answers,
                             String review, boolean draft, Instant dateAdded) {

    public static ReviewResponse from(ReviewView v) {
        return new ReviewResponse(v.studentId(), v.unitId(),
                v.submission().stream().map(Answer::getValue).toList(),
                v.review(), v.draft(), Instant.ofEpochSecond(v.dateAdded()));
    }
}
