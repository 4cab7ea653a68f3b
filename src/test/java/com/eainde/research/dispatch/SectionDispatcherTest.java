package com.eainde.research.dispatch;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;
import com.eainde.research.model.ResearchRequest;
import com.eainde.research.model.SectionOutcome;
import com.eainde.research.model.SectionResult;
import com.eainde.research.model.SectionSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SectionDispatcherTest {

    private static final ResearchRequest REQUEST = ResearchRequest.of("Topic", 6, 2);
    private static final Duration GENEROUS = Duration.ofSeconds(10);

    private final List<SectionOutcome> heard = new CopyOnWriteArrayList<>();

    private static List<SectionSpec> sections(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new SectionSpec(i, "Section " + i, List.of()))
                .collect(Collectors.toList());
    }

    private static SectionResult resultFor(SectionSpec section) {
        return new SectionResult(section.index(), section.title(), "content " + section.index(),
                List.of("https://example.com/" + section.index()), List.of("q"));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResearchPipelineException(ErrorKind.TIMEOUT, "interrupted");
        }
    }

    // =========================================================================
    //  Fan-out / fan-in
    // =========================================================================

    @Nested
    @DisplayName("Fan-out and fan-in")
    class FanOut {

        @Test
        @DisplayName("every section gets exactly one outcome keyed by its index")
        void allComplete() {
            SectionDispatcher dispatcher = new SectionDispatcher((request, section) -> {
                sleep(10L * (6 - section.index()));
                return resultFor(section);
            });

            SortedMap<Integer, SectionOutcome> outcomes =
                    dispatcher.dispatch(REQUEST, sections(6), 3, GENEROUS, heard::add);

            assertThat(outcomes.keySet()).containsExactly(0, 1, 2, 3, 4, 5);
            assertThat(outcomes.values()).allMatch(SectionOutcome::succeeded);
            outcomes.forEach((index, outcome) -> {
                assertThat(outcome.result().index()).isEqualTo(index);
                assertThat(outcome.result().content()).isEqualTo("content " + index);
            });
            assertThat(heard).hasSize(6);
        }

        @Test
        @DisplayName("never more than the concurrency limit run at once")
        void concurrencyBound() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            SectionDispatcher dispatcher = new SectionDispatcher((request, section) -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                sleep(40);
                running.decrementAndGet();
                return resultFor(section);
            });

            dispatcher.dispatch(REQUEST, sections(8), 2, GENEROUS, heard::add);

            assertThat(peak.get()).isLessThanOrEqualTo(2);
            assertThat(heard).hasSize(8);
        }

        @Test
        @DisplayName("an empty section list dispatches nothing")
        void empty() {
            SectionDispatcher dispatcher = new SectionDispatcher((request, section) -> {
                throw new AssertionError("should not run");
            });

            assertThat(dispatcher.dispatch(REQUEST, List.of(), 3, GENEROUS, heard::add)).isEmpty();
            assertThat(heard).isEmpty();
        }

        @Test
        @DisplayName("a concurrency limit below one is rejected")
        void invalidLimit() {
            SectionDispatcher dispatcher = new SectionDispatcher((request, section) -> resultFor(section));

            assertThatThrownBy(() -> dispatcher.dispatch(REQUEST, sections(1), 0, GENEROUS, heard::add))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // =========================================================================
    //  Failure isolation
    // =========================================================================

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("one failing section does not affect the others")
        void isolation() {
            SectionDispatcher dispatcher = new SectionDispatcher((request, section) -> {
                if (section.index() == 1) {
                    throw new ResearchPipelineException(ErrorKind.RATE_LIMITED, "quota");
                }
                return resultFor(section);
            });

            SortedMap<Integer, SectionOutcome> outcomes =
                    dispatcher.dispatch(REQUEST, sections(3), 3, GENEROUS, heard::add);

            assertThat(outcomes.get(0).succeeded()).isTrue();
            assertThat(outcomes.get(2).succeeded()).isTrue();
            assertThat(outcomes.get(1).succeeded()).isFalse();
            assertThat(outcomes.get(1).failure().kind()).isEqualTo(ErrorKind.RATE_LIMITED);
            assertThat(outcomes.get(1).title()).isEqualTo("Section 1");
        }

        @Test
        @DisplayName("unexpected errors and mismatched results become INTERNAL failures")
        void internal() {
            SectionDispatcher dispatcher = new SectionDispatcher((request, section) -> {
                if (section.index() == 0) {
                    throw new IllegalStateException("boom");
                }
                return resultFor(new SectionSpec(section.index() + 10, "other", List.of()));
            });

            SortedMap<Integer, SectionOutcome> outcomes =
                    dispatcher.dispatch(REQUEST, sections(2), 2, GENEROUS, heard::add);

            assertThat(outcomes.values())
                    .extracting(o -> o.failure().kind())
                    .containsOnly(ErrorKind.INTERNAL);
        }

        @Test
        @DisplayName("the stage timeout cancels unfinished sections and keeps completed ones")
        void stageTimeout() {
            SectionDispatcher dispatcher = new SectionDispatcher((request, section) -> {
                if (section.index() == 1) {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new ResearchPipelineException(ErrorKind.TIMEOUT, "cancelled");
                    }
                }
                return resultFor(section);
            });

            long start = System.nanoTime();
            SortedMap<Integer, SectionOutcome> outcomes =
                    dispatcher.dispatch(REQUEST, sections(3), 3, Duration.ofMillis(300), heard::add);
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertThat(elapsedMillis).isLessThan(5_000);
            assertThat(outcomes.get(0).succeeded()).isTrue();
            assertThat(outcomes.get(2).succeeded()).isTrue();
            assertThat(outcomes.get(1).failure().kind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(new ArrayList<>(heard)).extracting(SectionOutcome::index).containsExactlyInAnyOrder(0, 1, 2);
        }

        @Test
        @DisplayName("sections that finished as the deadline passed keep their own outcome")
        void finishedAtDeadline() throws InterruptedException {
            SectionDispatcher dispatcher = new SectionDispatcher((request, section) -> resultFor(section));
            List<SectionSpec> sections = sections(3);
            CompletableFuture<SectionOutcome> unfinished = new CompletableFuture<>();
            CompletableFuture<SectionOutcome> crashed = new CompletableFuture<>();
            crashed.completeExceptionally(new IllegalStateException("boom"));

            Map<Future<SectionOutcome>, SectionSpec> pending = new LinkedHashMap<>();
            pending.put(CompletableFuture.completedFuture(SectionOutcome.success(resultFor(sections.get(0)))),
                    sections.get(0));
            pending.put(unfinished, sections.get(1));
            pending.put(crashed, sections.get(2));
            SortedMap<Integer, SectionOutcome> outcomes = new TreeMap<>();

            dispatcher.timeOut(pending, Duration.ofMillis(300), outcomes, heard::add);

            assertThat(outcomes.get(0).succeeded()).isTrue();
            assertThat(outcomes.get(1).failure().kind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(outcomes.get(2).failure().kind()).isEqualTo(ErrorKind.INTERNAL);
            assertThat(unfinished.isCancelled()).isTrue();
            assertThat(pending).isEmpty();
            assertThat(heard).extracting(SectionOutcome::index).containsExactly(0, 1, 2);
        }
    }
}
