package com.eainde.research.controller;

import com.eainde.research.coordinator.InvalidResearchRequestException;
import com.eainde.research.coordinator.PipelineCoordinator;
import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.Failure;
import com.eainde.research.model.FinalReport;
import com.eainde.research.model.PipelineRun;
import com.eainde.research.model.ReportMetadata;
import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.ResearchRequest;
import com.eainde.research.model.RunStatus;
import com.eainde.research.model.SectionSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ResearchRunControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final ResearchRequest REQUEST = ResearchRequest.of("Ocean energy", 1, 1);
    private static final ResearchPlan PLAN = new ResearchPlan("Ocean energy", "Desk research",
            List.of(new SectionSpec(0, "Tidal", List.of())));

    private PipelineCoordinator coordinator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        coordinator = mock(PipelineCoordinator.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ResearchRunController(coordinator)).build();
    }

    private static PipelineRun researching() {
        return PipelineRun.accept("run-1", REQUEST, NOW)
                .transitionTo(RunStatus.PLANNING, NOW)
                .planned(PLAN, NOW);
    }

    private static PipelineRun completed() {
        FinalReport report = new FinalReport("Ocean energy", "summary", List.of(), "conclusion", List.of(),
                "# Ocean energy - Comprehensive Research Report", new ReportMetadata(0, List.of(), 0, 0, 5, NOW));
        return researching().transitionTo(RunStatus.REPORT, NOW).completed(report, NOW);
    }

    // =========================================================================
    //  Submit
    // =========================================================================

    @Nested
    @DisplayName("POST /research-runs")
    class Submit {

        @Test
        @DisplayName("accepts a request with default counts")
        void accepted() throws Exception {
            when(coordinator.submit(ResearchRequest.of("Ocean energy", 5, 3))).thenReturn("run-1");

            mockMvc.perform(post("/research-runs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"topic\": \"Ocean energy\"}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.runId").value("run-1"))
                    .andExpect(jsonPath("$.status").value("ACCEPTED"));
        }

        @Test
        @DisplayName("rejects an invalid request with 400 and the failure details")
        void invalid() throws Exception {
            when(coordinator.submit(any())).thenThrow(
                    new InvalidResearchRequestException("run-9", "topic must not be blank"));

            mockMvc.perform(post("/research-runs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"topic\": \" \", \"sectionCount\": 2, \"searchDepth\": 2}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.runId").value("run-9"))
                    .andExpect(jsonPath("$.status").value("FAILED"))
                    .andExpect(jsonPath("$.errorKind").value("INVALID_REQUEST"))
                    .andExpect(jsonPath("$.errorMessage").value("topic must not be blank"));
        }
    }

    // =========================================================================
    //  Queries
    // =========================================================================

    @Nested
    @DisplayName("GET /research-runs/{runId}")
    class Get {

        @Test
        @DisplayName("returns progress with the plan and no report before completion")
        void inProgress() throws Exception {
            when(coordinator.find("run-1")).thenReturn(Optional.of(researching()));

            mockMvc.perform(get("/research-runs/run-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("RESEARCH"))
                    .andExpect(jsonPath("$.plan.sections[0].title").value("Tidal"))
                    .andExpect(jsonPath("$.report").doesNotExist());
        }

        @Test
        @DisplayName("returns the failure of a failed run")
        void failed() throws Exception {
            PipelineRun failed = researching()
                    .failed(Failure.of(RunStatus.RESEARCH, ErrorKind.INSUFFICIENT_SECTIONS, "0 of 1"), NOW);
            when(coordinator.find("run-1")).thenReturn(Optional.of(failed));

            mockMvc.perform(get("/research-runs/run-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.failedStage").value("RESEARCH"))
                    .andExpect(jsonPath("$.errorKind").value("INSUFFICIENT_SECTIONS"));
        }

        @Test
        @DisplayName("404 for an unknown run")
        void unknown() throws Exception {
            when(coordinator.find("nope")).thenReturn(Optional.empty());

            mockMvc.perform(get("/research-runs/nope")).andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("GET /research-runs/{runId}/report")
    class Report {

        @Test
        @DisplayName("returns the Markdown document of a completed run")
        void markdown() throws Exception {
            when(coordinator.find("run-1")).thenReturn(Optional.of(completed()));

            mockMvc.perform(get("/research-runs/run-1/report"))
                    .andExpect(status().isOk())
                    .andExpect(content().contentTypeCompatibleWith("text/markdown"))
                    .andExpect(content().string(containsString("Comprehensive Research Report")));
        }

        @Test
        @DisplayName("409 while the run is still in progress")
        void notReady() throws Exception {
            when(coordinator.find("run-1")).thenReturn(Optional.of(researching()));

            mockMvc.perform(get("/research-runs/run-1/report"))
                    .andExpect(status().isConflict())
                    .andExpect(content().string(containsString("RESEARCH")));
        }
    }

    @Nested
    @DisplayName("POST /research-runs/{runId}/resume")
    class Resume {

        @Test
        @DisplayName("schedules a non-terminal run")
        void resumes() throws Exception {
            when(coordinator.find("run-1")).thenReturn(Optional.of(researching()));

            mockMvc.perform(post("/research-runs/run-1/resume")).andExpect(status().isAccepted());

            verify(coordinator).resume("run-1");
        }

        @Test
        @DisplayName("409 for a terminal run")
        void terminal() throws Exception {
            when(coordinator.find("run-1")).thenReturn(Optional.of(completed()));

            mockMvc.perform(post("/research-runs/run-1/resume")).andExpect(status().isConflict());

            verify(coordinator, never()).resume(any());
        }

        @Test
        @DisplayName("404 for an unknown run")
        void unknown() throws Exception {
            when(coordinator.find("nope")).thenReturn(Optional.empty());

            mockMvc.perform(post("/research-runs/nope/resume")).andExpect(status().isNotFound());
        }
    }
}
