package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The persisted, resumable record of one request's progress end-to-end.
 *
 * <p>Instances are immutable; every mutation returns a new record which the
 * coordinator persists before doing anything else. Transitions are checked
 * against {@link RunStatus#canTransitionTo(RunStatus)}.</p>
 *
 * @param runId           run identifier
 * @param request         the accepted request
 * @param status          current state label
 * @param plan            research plan, null until Planning completed
 * @param sectionOutcomes section identity → outcome, iterated in plan order
 * @param report          final report, null until the run completed
 * @param failure         failure record, null unless the run failed
 * @param createdAt       acceptance time
 * @param updatedAt       time of the last persisted change
 */
public record PipelineRun(
        @JsonProperty("runId")           String runId,
        @JsonProperty("request")         ResearchRequest request,
        @JsonProperty("status")          RunStatus status,
        @JsonProperty("plan")            ResearchPlan plan,
        @JsonProperty("sectionOutcomes") Map<Integer, SectionOutcome> sectionOutcomes,
        @JsonProperty("report")          FinalReport report,
        @JsonProperty("failure")         Failure failure,
        @JsonProperty("createdAt")       Instant createdAt,
        @JsonProperty("updatedAt")       Instant updatedAt
) implements Serializable {

    public PipelineRun {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(status, "status");
        SortedMap<Integer, SectionOutcome> ordered = new TreeMap<>();
        if (sectionOutcomes != null) {
            ordered.putAll(sectionOutcomes);
        }
        sectionOutcomes = Collections.unmodifiableSortedMap(ordered);
    }

    public static PipelineRun accept(String runId, ResearchRequest request, Instant now) {
        return new PipelineRun(runId, request, RunStatus.ACCEPTED, null, Map.of(), null, null, now, now);
    }

    // =========================================================================
    //  Transitions
    // =========================================================================

    public PipelineRun transitionTo(RunStatus next, Instant now) {
        if (next == RunStatus.FAILED || next == RunStatus.COMPLETED) {
            throw new IllegalStateException("Use failed()/completed() to enter " + next);
        }
        requireTransition(next);
        return new PipelineRun(runId, request, next, plan, sectionOutcomes, report, failure, createdAt, now);
    }

    /**
     * Stores the plan and moves the run from PLANNING to RESEARCH in one step,
     * so a persisted RESEARCH run always carries its plan.
     */
    public PipelineRun planned(ResearchPlan researchPlan, Instant now) {
        Objects.requireNonNull(researchPlan, "researchPlan");
        if (plan != null) {
            throw new IllegalStateException("Run " + runId + " already has a plan");
        }
        requireTransition(RunStatus.RESEARCH);
        return new PipelineRun(runId, request, RunStatus.RESEARCH, researchPlan, sectionOutcomes,
                report, failure, createdAt, now);
    }

    /**
     * Records one section outcome. A recorded outcome is never replaced.
     */
    public PipelineRun withSectionOutcome(SectionOutcome outcome, Instant now) {
        if (status != RunStatus.RESEARCH) {
            throw new IllegalStateException("Section outcomes can only be recorded during RESEARCH, run "
                    + runId + " is " + status);
        }
        if (sectionOutcomes.containsKey(outcome.index())) {
            throw new IllegalStateException("Section " + outcome.index() + " of run " + runId
                    + " already has an outcome");
        }
        Map<Integer, SectionOutcome> next = new TreeMap<>(sectionOutcomes);
        next.put(outcome.index(), outcome);
        return new PipelineRun(runId, request, status, plan, next, report, failure, createdAt, now);
    }

    public PipelineRun completed(FinalReport finalReport, Instant now) {
        Objects.requireNonNull(finalReport, "finalReport");
        requireTransition(RunStatus.COMPLETED);
        return new PipelineRun(runId, request, RunStatus.COMPLETED, plan, sectionOutcomes, finalReport,
                null, createdAt, now);
    }

    public PipelineRun failed(Failure runFailure, Instant now) {
        Objects.requireNonNull(runFailure, "runFailure");
        requireTransition(RunStatus.FAILED);
        return new PipelineRun(runId, request, RunStatus.FAILED, plan, sectionOutcomes, null,
                runFailure, createdAt, now);
    }

    private void requireTransition(RunStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + status + " to " + next);
        }
    }

    // =========================================================================
    //  Queries
    // =========================================================================

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * @return planned sections that have no recorded outcome yet, in plan order
     */
    public List<SectionSpec> pendingSections() {
        if (plan == null) {
            return List.of();
        }
        return plan.sections().stream()
                .filter(s -> !sectionOutcomes.containsKey(s.index()))
                .collect(Collectors.toList());
    }

    /**
     * @return successful section results in plan order
     */
    public List<SectionResult> successfulResults() {
        return sectionOutcomes.values().stream()
                .filter(SectionOutcome::succeeded)
                .map(SectionOutcome::result)
                .collect(Collectors.toList());
    }

    /**
     * @return titles of sections whose sub-pipeline failed, in plan order
     */
    public List<String> failedSectionTitles() {
        return sectionOutcomes.values().stream()
                .filter(o -> !o.succeeded())
                .map(SectionOutcome::title)
                .collect(Collectors.toList());
    }
}
