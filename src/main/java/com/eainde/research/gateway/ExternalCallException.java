package com.eainde.research.gateway;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;

/**
 * A classified failure of an external call.
 *
 * <p>Collaborators may throw it themselves to state the classification
 * explicitly; the gateway throws it once an invocation is exhausted or hits a
 * non-retryable error, with {@link #getAttempts()} set to the number of
 * underlying attempts made.</p>
 */
public class ExternalCallException extends ResearchPipelineException {

    private final CallKind callKind;
    private final int attempts;

    public ExternalCallException(ErrorKind kind, String message) {
        this(kind, null, 0, message, null);
    }

    public ExternalCallException(ErrorKind kind, String message, Throwable cause) {
        this(kind, null, 0, message, cause);
    }

    public ExternalCallException(ErrorKind kind, CallKind callKind, int attempts, String message, Throwable cause) {
        super(kind, message, cause);
        this.callKind = callKind;
        this.attempts = attempts;
    }

    public CallKind getCallKind() {
        return callKind;
    }

    public int getAttempts() {
        return attempts;
    }
}
