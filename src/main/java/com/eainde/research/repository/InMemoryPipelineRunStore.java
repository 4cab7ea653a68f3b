package com.eainde.research.repository;

import com.eainde.research.model.PipelineRun;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Non-durable store for tests and local runs. Nothing survives a restart.
 */
public class InMemoryPipelineRunStore implements PipelineRunStore {

    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();

    @Override
    public void save(PipelineRun run) {
        runs.put(run.runId(), run);
    }

    @Override
    public Optional<PipelineRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<PipelineRun> findIncomplete() {
        return runs.values().stream()
                .filter(run -> !run.isTerminal())
                .sorted(Comparator.comparing(PipelineRun::createdAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }
}
