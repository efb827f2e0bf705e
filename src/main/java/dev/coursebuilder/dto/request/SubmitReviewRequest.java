package dev.coursebuilder.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A missing {@code draft} flag saves a draft. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitReviewRequest(String review, Boolean draft) {
    public boolean isDraft() {
        return draft == null || draft;
    }
}
