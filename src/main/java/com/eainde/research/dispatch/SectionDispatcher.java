package com.eainde.research.dispatch;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;
import com.eainde.research.model.ResearchRequest;
import com.eainde.research.model.SectionOutcome;
import com.eainde.research.model.SectionResult;
import com.eainde.research.model.SectionSpec;
import com.eainde.research.thread.MdcAwareThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fans a list of sections out to concurrent research sub-pipelines and fans
 * their outcomes back in.
 *
 * <h3>Guarantees:</h3>
 * <ul>
 *   <li>at most {@code concurrencyLimit} sub-pipelines run at once; the rest
 *       queue and all of them eventually run</li>
 *   <li>sub-pipelines share no state; one failing never affects another</li>
 *   <li>every dispatched section gets exactly one outcome, keyed by its index</li>
 *   <li>outcomes reach the listener in completion order, one at a time, on the
 *       dispatching thread</li>
 *   <li>when the stage timeout elapses, unfinished sub-pipelines are
 *       cancelled and recorded as {@link ErrorKind#TIMEOUT}; completed
 *       outcomes are kept</li>
 * </ul>
 */
@Log4j2
public class SectionDispatcher {

    static final String SECTION_MDC_KEY = "section";

    private final SectionRunner sectionRunner;

    public SectionDispatcher(SectionRunner sectionRunner) {
        this.sectionRunner = sectionRunner;
    }

    /**
     * @param request          the run's request
     * @param sections         sections to research
     * @param concurrencyLimit maximum concurrently running sub-pipelines
     * @param stageTimeout     overall budget for all sections
     * @param listener         receives each outcome as it completes
     * @return section index → outcome, in index order. Sections still pending
     *         when the dispatching thread is interrupted have no entry.
     */
    public SortedMap<Integer, SectionOutcome> dispatch(ResearchRequest request,
                                                       List<SectionSpec> sections,
                                                       int concurrencyLimit,
                                                       Duration stageTimeout,
                                                       SectionOutcomeListener listener) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1, was " + concurrencyLimit);
        }
        SortedMap<Integer, SectionOutcome> outcomes = new TreeMap<>();
        if (sections.isEmpty()) {
            return outcomes;
        }

        int workers = Math.min(concurrencyLimit, sections.size());
        log.info("Dispatching {} sections on {} workers, stage timeout {}", sections.size(), workers, stageTimeout);

        MdcAwareThreadPoolExecutor pool = MdcAwareThreadPoolExecutor.fixed(workers, "section-");
        CompletionService<SectionOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<SectionOutcome>, SectionSpec> pending = new LinkedHashMap<>();
        try {
            for (SectionSpec section : sections) {
                pending.put(completion.submit(() -> runSection(request, section)), section);
            }

            long deadline = System.nanoTime() + stageTimeout.toNanos();
            while (!pending.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                Future<SectionOutcome> done = remaining > 0
                        ? completion.poll(remaining, TimeUnit.NANOSECONDS)
                        : null;
                if (done == null) {
                    timeOut(pending, stageTimeout, outcomes, listener);
                    break;
                }
                SectionSpec section = pending.remove(done);
                record(outcomeOf(done, section), outcomes, listener);
            }
        } catch (InterruptedException e) {
            log.warn("Dispatch interrupted, cancelling {} pending sections", pending.size());
            pending.keySet().forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdownNow();
        }
        return outcomes;
    }

    private SectionOutcome runSection(ResearchRequest request, SectionSpec section) {
        MDC.put(SECTION_MDC_KEY, String.valueOf(section.index()));
        try {
            log.info("{} started", section);
            SectionResult result = sectionRunner.research(request, section);
            if (result == null || result.index() != section.index()) {
                return SectionOutcome.failure(section, ErrorKind.INTERNAL,
                        "Sub-pipeline returned a result for another section");
            }
            log.info("{} completed with {} sources", section, result.sources().size());
            return SectionOutcome.success(result);
        } catch (ResearchPipelineException e) {
            log.warn("{} failed as {}: {}", section, e.getKind(), e.getMessage());
            return SectionOutcome.failure(section, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", section, e);
            return SectionOutcome.failure(section, ErrorKind.INTERNAL, String.valueOf(e));
        } finally {
            MDC.remove(SECTION_MDC_KEY);
        }
    }

    private SectionOutcome outcomeOf(Future<SectionOutcome> done, SectionSpec section) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            log.error("{} sub-pipeline crashed", section, e.getCause());
            return SectionOutcome.failure(section, ErrorKind.INTERNAL, String.valueOf(e.getCause()));
        } catch (CancellationException e) {
            return SectionOutcome.failure(section, ErrorKind.TIMEOUT, "Sub-pipeline was cancelled");
        }
    }

    /**
     * Settles every pending section at the stage deadline. Sections that finished
     * while the deadline was being reached keep their own outcome; the rest are
     * cancelled and recorded as {@link ErrorKind#TIMEOUT}.
     */
    void timeOut(Map<Future<SectionOutcome>, SectionSpec> pending, Duration stageTimeout,
                 SortedMap<Integer, SectionOutcome> outcomes, SectionOutcomeListener listener)
            throws InterruptedException {
        log.warn("Research stage timed out after {}, settling {} sections", stageTimeout, pending.size());
        for (Map.Entry<Future<SectionOutcome>, SectionSpec> entry : pending.entrySet()) {
            Future<SectionOutcome> future = entry.getKey();
            if (future.isDone()) {
                record(outcomeOf(future, entry.getValue()), outcomes, listener);
                continue;
            }
            future.cancel(true);
            record(SectionOutcome.failure(entry.getValue(), ErrorKind.TIMEOUT,
                    "Research stage timed out after " + stageTimeout), outcomes, listener);
        }
        pending.clear();
    }

    private static void record(SectionOutcome outcome,
                               SortedMap<Integer, SectionOutcome> outcomes,
                               SectionOutcomeListener listener) {
        outcomes.put(outcome.index(), outcome);
        listener.onOutcome(outcome);
    }
}
