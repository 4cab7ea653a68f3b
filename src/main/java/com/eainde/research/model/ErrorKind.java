package com.eainde.research.model;

/**
 * Classification of every failure a run can end with.
 *
 * <p>The first group is produced by the external call gateway, the rest by
 * steps, stages and the coordinator.</p>
 */
public enum ErrorKind {

    // Gateway-level
    TRANSIENT(true),
    RATE_LIMITED(true),
    UNAVAILABLE(true),
    TIMEOUT(true),
    INVALID_INPUT(false),

    // Pipeline-level
    INVALID_REQUEST(false),
    INSUFFICIENT_SECTIONS(false),
    MALFORMED_RESPONSE(false),
    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * @return true if the gateway may attempt the call again
     */
    public boolean isRetryable() {
        return retryable;
    }
}
