package com.eainde.research.repository;

import com.eainde.research.model.PipelineRun;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of {@link PipelineRun} records, one per run id.
 */
public interface PipelineRunStore {

    /**
     * Inserts or replaces the record for {@code run.runId()}.
     */
    void save(PipelineRun run);

    Optional<PipelineRun> find(String runId);

    /**
     * @return every run that has not reached COMPLETED or FAILED
     */
    List<PipelineRun> findIncomplete();
}
