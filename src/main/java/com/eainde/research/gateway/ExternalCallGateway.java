package com.eainde.research.gateway;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.thread.MdcAwareThreadPoolExecutor;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.log4j.Log4j2;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The single entry point for every non-deterministic operation of a stage
 * graph (model inference, web search).
 *
 * <h3>Per invocation:</h3>
 * <ul>
 *   <li>each attempt runs on the gateway's worker pool under a
 *       {@link TimeLimiter}; a timed-out attempt is cancelled</li>
 *   <li>failures are classified by {@link ErrorClassifier}; retryable ones are
 *       retried by a {@link Retry} with exponential backoff up to
 *       {@link CallPolicy#getMaxAttempts()}</li>
 *   <li>{@link ErrorKind#INVALID_INPUT} is never retried</li>
 *   <li>on exhaustion an {@link ExternalCallException} carries the last
 *       classification and the number of attempts made</li>
 * </ul>
 *
 * <p>Thread-safe. Backoff sleeps happen on the calling thread, so one
 * section's retry never delays another section's call. Callers must not
 * assume exactly-once delivery of the underlying remote call.</p>
 */
@Log4j2
public class ExternalCallGateway implements AutoCloseable {

    private final TextGenerator textGenerator;
    private final WebSearchClient webSearchClient;
    private final GatewaySettings settings;
    private final ErrorClassifier classifier;
    private final ExecutorService attemptExecutor;
    private final Map<CallKind, TimeLimiter> timeLimiters = new EnumMap<>(CallKind.class);

    public ExternalCallGateway(TextGenerator textGenerator,
                               WebSearchClient webSearchClient,
                               GatewaySettings settings) {
        this(textGenerator, webSearchClient, settings, new ErrorClassifier());
    }

    public ExternalCallGateway(TextGenerator textGenerator,
                               WebSearchClient webSearchClient,
                               GatewaySettings settings,
                               ErrorClassifier classifier) {
        this.textGenerator = textGenerator;
        this.webSearchClient = webSearchClient;
        this.settings = settings;
        this.classifier = classifier;
        this.attemptExecutor = MdcAwareThreadPoolExecutor.cached("gateway-call-");
        for (CallKind kind : CallKind.values()) {
            CallPolicy policy = settings.policyFor(kind);
            policy.validate();
            timeLimiters.put(kind, timeLimiter(policy));
        }
    }

    // =========================================================================
    //  Typed operations
    // =========================================================================

    /**
     * Generates text for the given prompt.
     *
     * @param purpose name of the calling step
     * @param prompt  rendered prompt
     */
    public String generateText(String purpose, String prompt) {
        GenerationRequest request = new GenerationRequest(purpose, prompt, settings.getModel());
        return invoke(CallKind.GENERATE_TEXT, purpose, () -> textGenerator.generate(request));
    }

    /**
     * Runs one web search.
     */
    public List<SearchHit> search(String query, int maxResults) {
        List<SearchHit> hits = invoke(CallKind.WEB_SEARCH, query, () -> webSearchClient.search(query, maxResults));
        return hits == null ? List.of() : hits;
    }

    // =========================================================================
    //  Generic invocation
    // =========================================================================

    public <T> T invoke(CallKind kind, String description, Callable<T> call) {
        return invoke(kind, description, call, settings.policyFor(kind), timeLimiters.get(kind));
    }

    /**
     * Invokes {@code call} under an explicit policy instead of the configured one.
     */
    public <T> T invoke(CallKind kind, String description, Callable<T> call, CallPolicy policy) {
        policy.validate();
        return invoke(kind, description, call, policy, timeLimiter(policy));
    }

    private <T> T invoke(CallKind kind, String description, Callable<T> call,
                         CallPolicy policy, TimeLimiter timeLimiter) {
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = Retry.of(kind.name().toLowerCase() + "-call", retryConfig(policy));
        retry.getEventPublisher().onRetry(event -> log.warn(
                "{} '{}' failed on attempt {}/{}, retrying in {}ms: {}",
                kind, abbreviate(description), event.getNumberOfRetryAttempts(), policy.getMaxAttempts(),
                event.getWaitInterval().toMillis(), String.valueOf(event.getLastThrowable())));

        Callable<T> attempt = () -> {
            attempts.incrementAndGet();
            return timeLimiter.executeFutureSupplier(() -> attemptExecutor.submit(call));
        };

        try {
            T result = retry.executeCallable(attempt);
            if (attempts.get() > 1) {
                log.info("{} '{}' succeeded after {} attempts", kind, abbreviate(description), attempts.get());
            }
            return result;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ErrorKind errorKind = classifier.classify(e);
            log.error("{} '{}' failed terminally as {} after {} attempt(s)",
                    kind, abbreviate(description), errorKind, attempts.get());
            throw new ExternalCallException(errorKind, kind, attempts.get(),
                    kind + " failed as " + errorKind + " after " + attempts.get() + " attempt(s): " + e,
                    e);
        }
    }

    private RetryConfig retryConfig(CallPolicy policy) {
        return RetryConfig.custom()
                .maxAttempts(policy.getMaxAttempts())
                .intervalBiFunction((attempt, outcome) -> {
                    ErrorKind errorKind = outcome.isLeft()
                            ? classifier.classify(outcome.getLeft())
                            : ErrorKind.TRANSIENT;
                    return policy.backoffAfter(attempt, errorKind).toMillis();
                })
                .retryOnException(this::isRetryable)
                .build();
    }

    private boolean isRetryable(Throwable error) {
        if (error instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
            return false;
        }
        return classifier.classify(error).isRetryable();
    }

    private static TimeLimiter timeLimiter(CallPolicy policy) {
        return TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(policy.getTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }

    @Override
    public void close() {
        attemptExecutor.shutdownNow();
    }
}
