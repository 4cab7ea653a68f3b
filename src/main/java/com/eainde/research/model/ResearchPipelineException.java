package com.eainde.research.model;

/**
 * Base of all classified pipeline failures.
 */
public class ResearchPipelineException extends RuntimeException {

    private final ErrorKind kind;

    public ResearchPipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ResearchPipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
