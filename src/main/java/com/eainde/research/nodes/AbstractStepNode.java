package com.eainde.research.nodes;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.state.AgentState;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for the steps of every stage graph.
 * <p>
 * A step reads whatever it needs from the state and returns an update that may
 * only contain its declared output fields. A field already present in the
 * state is never overwritten; fields only accumulate. Violations and
 * unexpected errors fail the step as {@link ErrorKind#INTERNAL}; a
 * {@link ResearchPipelineException} keeps its own classification.
 * </p>
 * <p>
 * Steps run synchronously on the graph's thread and return an already
 * completed future. External calls go through the gateway, never retried here.
 * </p>
 *
 * @param <S> the stage state type
 */
@Log4j2
public abstract class AbstractStepNode<S extends AgentState> implements AsyncNodeAction<S> {

    private final String name;
    private final Set<String> writes;

    protected AbstractStepNode(String name, String... writes) {
        this.name = name;
        this.writes = new LinkedHashSet<>(List.of(writes));
    }

    /** Node id of this step in its stage graph. */
    public String name() {
        return name;
    }

    public Set<String> writes() {
        return Set.copyOf(writes);
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(S state) {
        long start = System.currentTimeMillis();
        log.debug("Step '{}' started", name);
        try {
            Map<String, Object> update = execute(state);
            checkWrites(state, update);
            log.info("Step '{}' finished in {}ms, wrote {}", name, System.currentTimeMillis() - start,
                    update.keySet());
            return CompletableFuture.completedFuture(update);
        } catch (StepFailedException e) {
            log.warn("{}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        } catch (ResearchPipelineException e) {
            log.warn("Step '{}' failed as {}: {}", name, e.getKind(), e.getMessage());
            return CompletableFuture.failedFuture(new StepFailedException(name, e.getKind(), e.getMessage(), e));
        } catch (RuntimeException e) {
            log.error("Step '{}' failed unexpectedly", name, e);
            return CompletableFuture.failedFuture(
                    new StepFailedException(name, ErrorKind.INTERNAL, String.valueOf(e), e));
        }
    }

    /**
     * Computes this step's update.
     *
     * @return the new fields, keyed by state channel
     */
    protected abstract Map<String, Object> execute(S state);

    private void checkWrites(S state, Map<String, Object> update) {
        if (update == null) {
            throw new StepFailedException(name, ErrorKind.INTERNAL, "returned no update", null);
        }
        for (String key : update.keySet()) {
            if (!writes.contains(key)) {
                throw new StepFailedException(name, ErrorKind.INTERNAL,
                        "wrote undeclared field '" + key + "', declared " + writes, null);
            }
            if (state.data().containsKey(key)) {
                throw new StepFailedException(name, ErrorKind.INTERNAL,
                        "attempted to overwrite field '" + key + "'", null);
            }
        }
    }
}
