package com.eainde.research.workflow;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.ResearchRequest;
import com.eainde.research.model.RunStatus;
import com.eainde.research.nodes.AnalyzeTopicNode;
import com.eainde.research.nodes.CreatePlanNode;
import com.eainde.research.state.PlanningState;
import com.eainde.research.state.StateKeys;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Planning stage graph: {@code analyze_topic → create_plan}.
 */
@Log4j2
@Component
public class PlanningStage {

    private final StageGraphRunner runner;
    private final AnalyzeTopicNode analyzeTopicNode;
    private final CreatePlanNode createPlanNode;

    public PlanningStage(StageGraphRunner runner,
                         AnalyzeTopicNode analyzeTopicNode,
                         CreatePlanNode createPlanNode) {
        this.runner = runner;
        this.analyzeTopicNode = analyzeTopicNode;
        this.createPlanNode = createPlanNode;
    }

    public ResearchPlan plan(ResearchRequest request) {
        log.info("Planning '{}' with {} sections", request.topic(), request.sectionCount());
        PlanningState state = runner.run(RunStatus.PLANNING, "planning", this::graph,
                Map.of(StateKeys.REQUEST, request));

        ResearchPlan plan = state.getPlan();
        if (plan == null) {
            throw new StageFailedException(RunStatus.PLANNING, null, ErrorKind.INTERNAL,
                    "Planning finished without a plan", null);
        }
        return plan;
    }

    StateGraph<PlanningState> graph() throws GraphStateException {
        StateGraph<PlanningState> workflow = new StateGraph<>(PlanningState::new);

        workflow.addNode(AnalyzeTopicNode.NAME, analyzeTopicNode);
        workflow.addNode(CreatePlanNode.NAME, createPlanNode);

        workflow.addEdge(START, AnalyzeTopicNode.NAME);
        workflow.addEdge(AnalyzeTopicNode.NAME, CreatePlanNode.NAME);
        workflow.addEdge(CreatePlanNode.NAME, END);
        return workflow;
    }
}
