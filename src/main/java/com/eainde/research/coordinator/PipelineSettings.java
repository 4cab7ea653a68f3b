package com.eainde.research.coordinator;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Construction-time configuration of the {@link PipelineCoordinator}.
 */
@Value
@Builder
public class PipelineSettings {

    /** Upper bound for {@code sectionCount}. */
    @Builder.Default
    int maxSectionCount = 10;

    /** Upper bound for {@code searchDepth}. */
    @Builder.Default
    int maxSearchDepth = 10;

    /** Section sub-pipelines running at once, per run. */
    @Builder.Default
    int concurrencyLimit = 3;

    @Builder.Default
    Duration researchStageTimeout = Duration.ofMinutes(15);

    @Builder.Default
    CompletionPolicy completionPolicy = CompletionPolicy.allSections();

    /** Runs advanced at once by the background executor. */
    @Builder.Default
    int maxConcurrentRuns = 4;
}
