package dev.coursebuilder.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.coursebuilder.domain.entity.Answer;
import dev.coursebuilder.exception.InvalidInputException;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitWorkRequest(List<AnswerPayload> answers) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnswerPayload(Integer index, String value) {}

    public List<Answer> toAnswers() {
        if (answers == null) throw new InvalidInputException("answers required");
        return answers.stream().map(a -> {
            if (a == null || a.index() == null) throw new InvalidInputException("every answer needs an index");
            return new Answer(a.index(), a.value());
        }).toList();
    }
}
