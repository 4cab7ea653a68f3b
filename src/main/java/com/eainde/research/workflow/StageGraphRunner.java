package com.eainde.research.workflow;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;
import com.eainde.research.model.RunStatus;
import com.eainde.research.nodes.StepFailedException;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Executes one stage graph to completion.
 * <p>
 * Every execution gets its own compiled graph and thread id, so concurrent
 * section sub-pipelines never share graph state. With checkpointing enabled
 * each step's state is kept in a {@link MemorySaver} for the lifetime of the
 * execution.
 * </p>
 * <p>
 * A failing step aborts the graph; its writes are not merged. The failure is
 * surfaced as a {@link StageFailedException} naming the stage, the step and
 * the error kind.
 * </p>
 */
@Log4j2
public class StageGraphRunner {

    /**
     * Builds the uncompiled graph of a stage.
     */
    @FunctionalInterface
    public interface GraphDefinition<S extends AgentState> {
        StateGraph<S> define() throws GraphStateException;
    }

    private final boolean checkpointing;

    public StageGraphRunner(boolean checkpointing) {
        this.checkpointing = checkpointing;
    }

    /**
     * @param stage      the stage being executed, used for failure attribution
     * @param label      prefix of the execution's thread id
     * @param definition the stage's graph
     * @param inputs     initial state
     * @return the final state
     * @throws StageFailedException if any step failed or the graph is invalid
     */
    public <S extends AgentState> S run(RunStatus stage, String label,
                                        GraphDefinition<S> definition,
                                        Map<String, Object> inputs) {
        String threadId = label + "-" + UUID.randomUUID().toString().substring(0, 8);
        CompiledGraph<S> graph = compile(stage, definition);
        RunnableConfig config = RunnableConfig.builder()
                .threadId(threadId)
                .build();

        log.debug("Executing {} graph, thread_id: {}", stage, threadId);
        Optional<S> result;
        try {
            result = graph.invoke(inputs, config);
        } catch (Exception e) {
            throw toStageFailure(stage, e);
        }

        if (checkpointing && log.isDebugEnabled()) {
            log.debug("{} graph finished with {} checkpoints, thread_id: {}",
                    stage, graph.getStateHistory(config).size(), threadId);
        }
        return result.orElseThrow(() -> new StageFailedException(stage, null, ErrorKind.INTERNAL,
                stage + " graph produced no final state", null));
    }

    private <S extends AgentState> CompiledGraph<S> compile(RunStatus stage, GraphDefinition<S> definition) {
        CompileConfig compileConfig = checkpointing
                ? CompileConfig.builder().checkpointSaver(new MemorySaver()).build()
                : CompileConfig.builder().build();
        try {
            return definition.define().compile(compileConfig);
        } catch (GraphStateException e) {
            throw new StageFailedException(stage, null, ErrorKind.INTERNAL,
                    "Invalid " + stage + " graph: " + e.getMessage(), e);
        }
    }

    static StageFailedException toStageFailure(RunStatus stage, Throwable error) {
        ResearchPipelineException classified = null;
        boolean interrupted = false;
        Throwable current = error;
        for (int depth = 0; current != null && depth < 20; depth++) {
            if (current instanceof InterruptedException) {
                interrupted = true;
            }
            if (current instanceof StepFailedException) {
                StepFailedException stepFailure = (StepFailedException) current;
                return new StageFailedException(stage, stepFailure.getStep(), stepFailure.getKind(),
                        stepFailure.getMessage(), stepFailure);
            }
            if (classified == null && current instanceof ResearchPipelineException) {
                classified = (ResearchPipelineException) current;
            }
            current = current.getCause();
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
            return new StageFailedException(stage, null, ErrorKind.TIMEOUT,
                    stage + " graph was interrupted", error);
        }
        if (classified != null) {
            return new StageFailedException(stage, null, classified.getKind(), classified.getMessage(), error);
        }
        return new StageFailedException(stage, null, ErrorKind.INTERNAL,
                stage + " graph failed: " + error, error);
    }
}
