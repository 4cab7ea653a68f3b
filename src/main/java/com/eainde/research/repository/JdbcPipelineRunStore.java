package com.eainde.research.repository;

import com.eainde.research.model.PipelineRun;
import com.eainde.research.model.RunStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Stores each run as one JSON document in table {@code pipeline_run}.
 * The status column duplicates the document's status for querying.
 */
@Log4j2
public class JdbcPipelineRunStore implements PipelineRunStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcPipelineRunStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(PipelineRun run) {
        String json;
        try {
            json = objectMapper.writeValueAsString(run);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run " + run.runId(), e);
        }

        jdbcTemplate.update("""
                MERGE INTO pipeline_run (run_id, status, run_data, updated_at)
                KEY (run_id)
                VALUES (?, ?, ?, CURRENT_TIMESTAMP)
                """, run.runId(), run.status().name(), json);
        log.debug("Saved run {} as {}", run.runId(), run.status());
    }

    @Override
    public Optional<PipelineRun> find(String runId) {
        try {
            String json = jdbcTemplate.queryForObject(
                    "SELECT run_data FROM pipeline_run WHERE run_id = ?",
                    String.class,
                    runId
            );
            return Optional.of(read(json));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    @Override
    public List<PipelineRun> findIncomplete() {
        return jdbcTemplate.query(
                "SELECT run_data FROM pipeline_run WHERE status NOT IN (?, ?) ORDER BY updated_at",
                (rs, rowNum) -> read(rs.getString("run_data")),
                RunStatus.COMPLETED.name(),
                RunStatus.FAILED.name()
        );
    }

    private PipelineRun read(String json) {
        try {
            return objectMapper.readValue(json, PipelineRun.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize run", e);
        }
    }
}
