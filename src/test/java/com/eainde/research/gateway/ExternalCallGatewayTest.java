package com.eainde.research.gateway;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.support.FakeWebSearchClient;
import dev.langchain4j.exception.HttpException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalCallGatewayTest {

    private static final CallPolicy POLICY = CallPolicy.builder()
            .timeout(Duration.ofMillis(150))
            .maxAttempts(3)
            .initialBackoff(Duration.ofMillis(5))
            .maxBackoff(Duration.ofMillis(20))
            .build();

    private final AtomicInteger attempts = new AtomicInteger();
    private ExternalCallGateway gateway;

    @AfterEach
    void closeGateway() {
        if (gateway != null) {
            gateway.close();
        }
    }

    private ExternalCallGateway gateway(TextGenerator textGenerator) {
        return gateway(textGenerator, new FakeWebSearchClient());
    }

    private ExternalCallGateway gateway(TextGenerator textGenerator, WebSearchClient webSearchClient) {
        gateway = new ExternalCallGateway(textGenerator, webSearchClient, GatewaySettings.builder()
                .generateTextPolicy(POLICY)
                .webSearchPolicy(POLICY)
                .build());
        return gateway;
    }

    // =========================================================================
    //  Retry
    // =========================================================================

    @Nested
    @DisplayName("Retry")
    class Retry {

        @Test
        @DisplayName("two transient failures then success: success with exactly three attempts")
        void transientTwiceThenSuccess() {
            gateway(request -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new HttpException(500, "internal error");
                }
                return "ok";
            });

            assertThat(gateway.generateText("analyze_topic", "prompt")).isEqualTo("ok");
            assertThat(attempts).hasValue(3);
        }

        @Test
        @DisplayName("invalid input is not retried")
        void invalidInputNotRetried() {
            gateway(request -> {
                attempts.incrementAndGet();
                throw new HttpException(400, "bad request");
            });

            assertThatThrownBy(() -> gateway.generateText("analyze_topic", "prompt"))
                    .isInstanceOfSatisfying(ExternalCallException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_INPUT);
                        assertThat(e.getAttempts()).isEqualTo(1);
                        assertThat(e.getCallKind()).isEqualTo(CallKind.GENERATE_TEXT);
                    });
            assertThat(attempts).hasValue(1);
        }

        @Test
        @DisplayName("exhausted rate limiting surfaces RATE_LIMITED after the attempt ceiling")
        void rateLimitedExhausted() {
            gateway(request -> {
                attempts.incrementAndGet();
                throw new HttpException(429, "too many requests");
            });

            assertThatThrownBy(() -> gateway.generateText("analyze_topic", "prompt"))
                    .isInstanceOfSatisfying(ExternalCallException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.RATE_LIMITED);
                        assertThat(e.getAttempts()).isEqualTo(3);
                    });
            assertThat(attempts).hasValue(3);
        }

        @Test
        @DisplayName("an explicit policy overrides the configured attempt ceiling")
        void explicitPolicy() {
            gateway(request -> "unused");

            assertThatThrownBy(() -> gateway.invoke(CallKind.GENERATE_TEXT, "custom", () -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("flaky");
            }, POLICY.toBuilder().maxAttempts(5).build()))
                    .isInstanceOfSatisfying(ExternalCallException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSIENT));
            assertThat(attempts).hasValue(5);
        }
    }

    // =========================================================================
    //  Timeout
    // =========================================================================

    @Nested
    @DisplayName("Timeout")
    class Timeout {

        @Test
        @DisplayName("every attempt timing out surfaces TIMEOUT after three attempts")
        void allAttemptsTimeOut() {
            gateway(request -> "unused", new FakeWebSearchClient().behave(q -> {
                attempts.incrementAndGet();
                return FakeWebSearchClient.hang(q);
            }));

            assertThatThrownBy(() -> gateway.search("slow query", 3))
                    .isInstanceOfSatisfying(ExternalCallException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT);
                        assertThat(e.getAttempts()).isEqualTo(3);
                        assertThat(e.getCallKind()).isEqualTo(CallKind.WEB_SEARCH);
                    });
            assertThat(attempts).hasValue(3);
        }

        @Test
        @DisplayName("a slow first attempt is retried and the second attempt's answer is returned")
        void slowThenFast() {
            gateway(request -> {
                if (attempts.incrementAndGet() == 1) {
                    sleep(1_000);
                }
                return "fast";
            });

            assertThat(gateway.generateText("create_plan", "prompt")).isEqualTo("fast");
            assertThat(attempts).hasValue(2);
        }
    }

    // =========================================================================
    //  Concurrency
    // =========================================================================

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("one call backing off does not block another caller")
        void backoffIsPerCall() throws Exception {
            CallPolicy slowBackoff = POLICY.toBuilder()
                    .initialBackoff(Duration.ofSeconds(2))
                    .maxBackoff(Duration.ofSeconds(2))
                    .build();
            gateway(request -> "quick");

            CountDownLatch firstFailed = new CountDownLatch(1);
            CompletableFuture<String> retrying = CompletableFuture.supplyAsync(() ->
                    gateway.invoke(CallKind.GENERATE_TEXT, "retrying", () -> {
                        if (attempts.incrementAndGet() == 1) {
                            firstFailed.countDown();
                            throw new HttpException(503, "unavailable");
                        }
                        return "late";
                    }, slowBackoff));

            assertThat(firstFailed.await(2, TimeUnit.SECONDS)).isTrue();
            long start = System.nanoTime();
            assertThat(gateway.generateText("analyze_topic", "prompt")).isEqualTo("quick");
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));

            assertThat(retrying.get(5, TimeUnit.SECONDS)).isEqualTo("late");
        }
    }

    @Test
    @DisplayName("search results are passed through unchanged")
    void searchPassesHits() {
        gateway(request -> "unused");
        List<SearchHit> hits = gateway.search("quantum computing", 5);

        assertThat(hits).extracting(SearchHit::url)
                .containsExactly("https://example.com/quantum-computing", "https://example.org/quantum-computing");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
