package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of one section sub-pipeline: exactly one of {@code result} or
 * {@code failure} is set.
 */
public record SectionOutcome(
        @JsonProperty("index")   int index,
        @JsonProperty("title")   String title,
        @JsonProperty("result")  SectionResult result,
        @JsonProperty("failure") Failure failure
) implements Serializable {

    public SectionOutcome {
        if ((result == null) == (failure == null)) {
            throw new IllegalArgumentException(
                    "Section outcome " + index + " must carry either a result or a failure");
        }
    }

    public static SectionOutcome success(SectionResult result) {
        Objects.requireNonNull(result, "result");
        return new SectionOutcome(result.index(), result.title(), result, null);
    }

    public static SectionOutcome failure(SectionSpec section, ErrorKind kind, String message) {
        return new SectionOutcome(section.index(), section.title(), null,
                Failure.of(RunStatus.RESEARCH, kind, message));
    }

    @JsonIgnore
    public boolean succeeded() {
        return result != null;
    }
}
