package com.eainde.research.controller.dto;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.FinalReport;
import com.eainde.research.model.PipelineRun;
import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.RunStatus;
import com.eainde.research.model.SectionOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * External view of a run. {@code report} is only set for completed runs,
 * {@code failedStage}/{@code errorKind} only for failed ones.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResearchRunResponse {

    String runId;
    RunStatus status;
    String topic;
    Integer sectionCount;
    Integer searchDepth;
    ResearchPlan plan;
    List<SectionOutcome> sections;
    FinalReport report;
    RunStatus failedStage;
    ErrorKind errorKind;
    String errorMessage;
    Instant createdAt;
    Instant updatedAt;

    public static ResearchRunResponse accepted(String runId) {
        return ResearchRunResponse.builder()
                .runId(runId)
                .status(RunStatus.ACCEPTED)
                .build();
    }

    public static ResearchRunResponse from(PipelineRun run) {
        ResearchRunResponseBuilder builder = ResearchRunResponse.builder()
                .runId(run.runId())
                .status(run.status())
                .plan(run.plan())
                .sections(new ArrayList<>(run.sectionOutcomes().values()))
                .createdAt(run.createdAt())
                .updatedAt(run.updatedAt());
        if (run.request() != null) {
            builder.topic(run.request().topic())
                    .sectionCount(run.request().sectionCount())
                    .searchDepth(run.request().searchDepth());
        }
        if (run.status() == RunStatus.COMPLETED) {
            builder.report(run.report());
        }
        if (run.failure() != null) {
            builder.failedStage(run.failure().stage())
                    .errorKind(run.failure().kind())
                    .errorMessage(run.failure().message());
        }
        return builder.build();
    }
}
