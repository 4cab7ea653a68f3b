package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A recorded failure: where it happened and how it was classified.
 *
 * @param stage   the run status the failure happened in
 * @param kind    the error classification
 * @param message human-readable detail
 */
public record Failure(
        @JsonProperty("stage")   RunStatus stage,
        @JsonProperty("kind")    ErrorKind kind,
        @JsonProperty("message") String message
) implements Serializable {

    public static Failure of(RunStatus stage, ErrorKind kind, String message) {
        return new Failure(stage, kind, message);
    }
}
