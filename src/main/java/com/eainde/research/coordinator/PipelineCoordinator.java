package com.eainde.research.coordinator;

import com.eainde.research.dispatch.SectionDispatcher;
import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.Failure;
import com.eainde.research.model.FinalReport;
import com.eainde.research.model.PipelineRun;
import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.ResearchRequest;
import com.eainde.research.model.RunStatus;
import com.eainde.research.model.SectionSpec;
import com.eainde.research.repository.PipelineRunStore;
import com.eainde.research.thread.MdcAwareThreadPoolExecutor;
import com.eainde.research.workflow.PlanningStage;
import com.eainde.research.workflow.ReportStage;
import com.eainde.research.workflow.StageFailedException;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The durable top-level sequencer of a research run.
 *
 * <pre>
 * ACCEPTED ──► PLANNING ──► RESEARCH ──► REPORT ──► COMPLETED
 *     │            │            │           │
 *     └────────────┴────────────┴───────────┴─────► FAILED
 * </pre>
 *
 * <p>The run is persisted after every transition and after every section
 * outcome, so a run can always be resumed from its last persisted state:</p>
 * <ul>
 *   <li>a PLANNING run is planned again (it never carries a plan)</li>
 *   <li>a RESEARCH run dispatches only the sections without a recorded
 *       outcome; recorded failures are not retried</li>
 *   <li>a REPORT run compiles the report from the recorded results</li>
 * </ul>
 *
 * <p>Stage failures are never retried here; the gateway already retried the
 * external calls. A failed run records the stage and error kind and never
 * carries a report.</p>
 */
@Log4j2
public class PipelineCoordinator implements AutoCloseable {

    static final String RUN_MDC_KEY = "runId";

    private final PlanningStage planningStage;
    private final SectionDispatcher dispatcher;
    private final ReportStage reportStage;
    private final PipelineRunStore store;
    private final PipelineSettings settings;
    private final Clock clock;
    private final ExecutorService runExecutor;
    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();

    public PipelineCoordinator(PlanningStage planningStage,
                               SectionDispatcher dispatcher,
                               ReportStage reportStage,
                               PipelineRunStore store,
                               PipelineSettings settings,
                               Clock clock) {
        this.planningStage = planningStage;
        this.dispatcher = dispatcher;
        this.reportStage = reportStage;
        this.store = store;
        this.settings = settings;
        this.clock = clock;
        this.runExecutor = MdcAwareThreadPoolExecutor.fixed(settings.getMaxConcurrentRuns(), "pipeline-run-");
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Validates and persists the request, then advances the run in the
     * background.
     *
     * @return the new run id
     * @throws InvalidResearchRequestException if validation fails; the run is
     *                                         persisted as FAILED first
     */
    public String submit(ResearchRequest request) {
        PipelineRun run = accept(request);
        schedule(run.runId());
        return run.runId();
    }

    /**
     * Like {@link #submit} but advances the run on the calling thread.
     *
     * @return the terminal run
     */
    public PipelineRun execute(ResearchRequest request) {
        return advance(accept(request).runId());
    }

    /**
     * Continues a persisted run in the background.
     *
     * @throws RunNotFoundException  if the run does not exist
     * @throws IllegalStateException if the run is already terminal
     */
    public void resume(String runId) {
        requireResumable(runId);
        schedule(runId);
    }

    /**
     * Continues a persisted run on the calling thread.
     */
    public PipelineRun resumeNow(String runId) {
        requireResumable(runId);
        return advance(runId);
    }

    /**
     * Schedules every non-terminal run found in the store.
     *
     * @return number of runs scheduled
     */
    public int resumeIncomplete() {
        List<PipelineRun> incomplete = store.findIncomplete();
        for (PipelineRun run : incomplete) {
            log.info("Resuming run {} from {}", run.runId(), run.status());
            schedule(run.runId());
        }
        return incomplete.size();
    }

    public Optional<PipelineRun> find(String runId) {
        return store.find(runId);
    }

    @Override
    public void close() {
        runExecutor.shutdownNow();
    }

    // =========================================================================
    //  Acceptance
    // =========================================================================

    private PipelineRun accept(ResearchRequest request) {
        String runId = UUID.randomUUID().toString();
        PipelineRun run = PipelineRun.accept(runId, request, now());

        String problem = validate(request);
        if (problem != null) {
            log.warn("Rejected run {}: {}", runId, problem);
            save(run.failed(Failure.of(RunStatus.ACCEPTED, ErrorKind.INVALID_REQUEST, problem), now()));
            throw new InvalidResearchRequestException(runId, problem);
        }

        log.info("Accepted run {} for '{}' ({} sections, depth {})",
                runId, request.topic(), request.sectionCount(), request.searchDepth());
        return save(run);
    }

    String validate(ResearchRequest request) {
        if (request == null) {
            return "request is required";
        }
        if (request.topic() == null || request.topic().isBlank()) {
            return "topic must not be blank";
        }
        if (request.sectionCount() < 1 || request.sectionCount() > settings.getMaxSectionCount()) {
            return "sectionCount must be between 1 and " + settings.getMaxSectionCount()
                    + ", was " + request.sectionCount();
        }
        if (request.searchDepth() < 1 || request.searchDepth() > settings.getMaxSearchDepth()) {
            return "searchDepth must be between 1 and " + settings.getMaxSearchDepth()
                    + ", was " + request.searchDepth();
        }
        return null;
    }

    // =========================================================================
    //  State machine
    // =========================================================================

    private void schedule(String runId) {
        runExecutor.execute(() -> {
            try {
                advance(runId);
            } catch (RuntimeException e) {
                log.error("Run {} stopped unexpectedly and stays resumable", runId, e);
            }
        });
    }

    PipelineRun advance(String runId) {
        if (!activeRuns.add(runId)) {
            log.info("Run {} is already being advanced", runId);
            return load(runId);
        }
        MDC.put(RUN_MDC_KEY, runId);
        try {
            PipelineRun run = load(runId);
            while (!run.isTerminal() && !Thread.currentThread().isInterrupted()) {
                run = step(run);
            }
            if (run.isTerminal()) {
                log.info("Run {} finished as {}", runId, run.status());
            } else {
                log.warn("Run {} interrupted in {}", runId, run.status());
            }
            return run;
        } finally {
            activeRuns.remove(runId);
            MDC.remove(RUN_MDC_KEY);
        }
    }

    private PipelineRun step(PipelineRun run) {
        switch (run.status()) {
            case ACCEPTED:
                return save(run.transitionTo(RunStatus.PLANNING, now()));
            case PLANNING:
                return plan(run);
            case RESEARCH:
                return research(run);
            case REPORT:
                return report(run);
            default:
                throw new IllegalStateException("No step for status " + run.status());
        }
    }

    private PipelineRun plan(PipelineRun run) {
        try {
            ResearchPlan plan = planningStage.plan(run.request());
            log.info("Run {} planned {} sections", run.runId(), plan.sectionCount());
            return save(run.planned(plan, now()));
        } catch (StageFailedException e) {
            return fail(run, e);
        }
    }

    private PipelineRun research(PipelineRun run) {
        List<SectionSpec> pending = run.pendingSections();
        AtomicReference<PipelineRun> current = new AtomicReference<>(run);
        if (!pending.isEmpty()) {
            log.info("Run {} researching {} of {} sections", run.runId(), pending.size(), run.plan().sectionCount());
            dispatcher.dispatch(run.request(), pending, settings.getConcurrencyLimit(),
                    settings.getResearchStageTimeout(),
                    outcome -> current.set(save(current.get().withSectionOutcome(outcome, now()))));
        }

        PipelineRun researched = current.get();
        if (!researched.pendingSections().isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                return researched;
            }
            return fail(researched, RunStatus.RESEARCH, ErrorKind.INTERNAL,
                    researched.pendingSections().size() + " sections finished without an outcome");
        }

        int planned = researched.plan().sectionCount();
        int succeeded = researched.successfulResults().size();
        if (!settings.getCompletionPolicy().accepts(succeeded, planned)) {
            return fail(researched, RunStatus.RESEARCH, ErrorKind.INSUFFICIENT_SECTIONS,
                    succeeded + " of " + planned + " sections succeeded, policy requires "
                            + settings.getCompletionPolicy() + "; failed: " + researched.failedSectionTitles());
        }
        if (succeeded < planned) {
            log.warn("Run {} continues without sections {}", run.runId(), researched.failedSectionTitles());
        }
        return save(researched.transitionTo(RunStatus.REPORT, now()));
    }

    private PipelineRun report(PipelineRun run) {
        try {
            FinalReport report = reportStage.compile(run.plan(), run.successfulResults(), run.failedSectionTitles());
            log.info("Run {} report ready, {} words", run.runId(), report.metadata().wordCount());
            return save(run.completed(report, now()));
        } catch (StageFailedException e) {
            return fail(run, e);
        }
    }

    private PipelineRun fail(PipelineRun run, StageFailedException e) {
        return fail(run, e.getStage(), e.getKind(), e.getMessage());
    }

    private PipelineRun fail(PipelineRun run, RunStatus stage, ErrorKind kind, String message) {
        log.error("Run {} failed in {} as {}: {}", run.runId(), stage, kind, message);
        return save(run.failed(Failure.of(stage, kind, message), now()));
    }

    // =========================================================================
    //  Persistence helpers
    // =========================================================================

    private void requireResumable(String runId) {
        PipelineRun run = load(runId);
        if (run.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is already " + run.status());
        }
    }

    private PipelineRun load(String runId) {
        return store.find(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private PipelineRun save(PipelineRun run) {
        store.save(run);
        return run;
    }

    private Instant now() {
        return clock.instant();
    }
}
