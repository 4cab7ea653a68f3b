package com.eainde.research.controller;

import com.eainde.research.controller.dto.CreateResearchRunRequest;
import com.eainde.research.controller.dto.ResearchRunResponse;
import com.eainde.research.coordinator.InvalidResearchRequestException;
import com.eainde.research.coordinator.PipelineCoordinator;
import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.PipelineRun;
import com.eainde.research.model.RunStatus;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@Log4j2
@RestController
@RequestMapping("/research-runs")
public class ResearchRunController {

    private static final MediaType MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final PipelineCoordinator coordinator;

    public ResearchRunController(PipelineCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Accepts a research request. The run proceeds asynchronously; poll
     * {@code GET /research-runs/{runId}} for progress.
     */
    @PostMapping
    public ResponseEntity<ResearchRunResponse> submit(@RequestBody CreateResearchRunRequest request) {
        try {
            String runId = coordinator.submit(request.toResearchRequest());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResearchRunResponse.accepted(runId));
        } catch (InvalidResearchRequestException e) {
            return ResponseEntity.badRequest().body(ResearchRunResponse.builder()
                    .runId(e.getRunId())
                    .status(RunStatus.FAILED)
                    .failedStage(RunStatus.ACCEPTED)
                    .errorKind(ErrorKind.INVALID_REQUEST)
                    .errorMessage(e.getMessage())
                    .build());
        }
    }

    @GetMapping("/{runId}")
    public ResponseEntity<ResearchRunResponse> get(@PathVariable String runId) {
        return coordinator.find(runId)
                .map(run -> ResponseEntity.ok(ResearchRunResponse.from(run)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * The rendered Markdown report; 409 until the run has completed.
     */
    @GetMapping("/{runId}/report")
    public ResponseEntity<String> report(@PathVariable String runId) {
        Optional<PipelineRun> run = coordinator.find(runId);
        if (run.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (run.get().status() != RunStatus.COMPLETED) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body("Run " + runId + " is " + run.get().status());
        }
        return ResponseEntity.ok()
                .contentType(MARKDOWN)
                .body(run.get().report().markdown());
    }

    @PostMapping("/{runId}/resume")
    public ResponseEntity<ResearchRunResponse> resume(@PathVariable String runId) {
        Optional<PipelineRun> run = coordinator.find(runId);
        if (run.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (run.get().isTerminal()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ResearchRunResponse.from(run.get()));
        }
        try {
            coordinator.resume(runId);
        } catch (IllegalStateException e) {
            log.info("Resume of run {} rejected: {}", runId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResearchRunResponse.from(run.get()));
    }
}
