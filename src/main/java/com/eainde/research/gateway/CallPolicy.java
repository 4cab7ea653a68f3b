package com.eainde.research.gateway;

import com.eainde.research.model.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Timeout and retry policy applied to one kind of external call.
 *
 * <pre>
 * wait(attempt) = min(initialBackoff * backoffMultiplier^(attempt-1), maxBackoff)
 *   RATE_LIMITED : wait * rateLimitBackoffFactor (capped at maxBackoff * rateLimitBackoffFactor)
 *   UNAVAILABLE  : initialBackoff
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class CallPolicy {

    @Builder.Default
    Duration timeout = Duration.ofSeconds(45);

    /** Total attempts including the first one. */
    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration initialBackoff = Duration.ofSeconds(1);

    @Builder.Default
    double backoffMultiplier = 2.0;

    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(30);

    @Builder.Default
    double rateLimitBackoffFactor = 4.0;

    public static CallPolicy defaults() {
        return CallPolicy.builder().build();
    }

    /**
     * @param attempt   1-based number of the attempt that just failed
     * @param errorKind classification of that failure
     * @return how long to wait before the next attempt
     */
    public Duration backoffAfter(int attempt, ErrorKind errorKind) {
        if (errorKind == ErrorKind.UNAVAILABLE) {
            return initialBackoff;
        }
        double exponential = initialBackoff.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(exponential, maxBackoff.toMillis());
        if (errorKind == ErrorKind.RATE_LIMITED) {
            capped = (long) (capped * rateLimitBackoffFactor);
        }
        return Duration.ofMillis(capped);
    }

    void validate() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
    }
}
