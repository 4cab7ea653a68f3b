package com.eainde.research.workflow;

import com.eainde.research.dispatch.SectionRunner;
import com.eainde.research.edges.SearchOutcomeRoutingEdge;
import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchRequest;
import com.eainde.research.model.RunStatus;
import com.eainde.research.model.SectionResult;
import com.eainde.research.model.SectionSpec;
import com.eainde.research.nodes.ConductSearchesNode;
import com.eainde.research.nodes.GenerateQueriesNode;
import com.eainde.research.nodes.SynthesizeBackgroundNode;
import com.eainde.research.nodes.SynthesizeFindingsNode;
import com.eainde.research.state.SectionResearchState;
import com.eainde.research.state.StateKeys;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Research stage graph, executed once per section:
 * <pre>
 * generate_queries → conduct_searches ─┬─ findings   → synthesize_findings   → END
 *                                      └─ background → synthesize_background → END
 * </pre>
 */
@Component
public class SectionResearchStage implements SectionRunner {

    private final StageGraphRunner runner;
    private final GenerateQueriesNode generateQueriesNode;
    private final ConductSearchesNode conductSearchesNode;
    private final SynthesizeFindingsNode synthesizeFindingsNode;
    private final SynthesizeBackgroundNode synthesizeBackgroundNode;
    private final SearchOutcomeRoutingEdge routingEdge;

    public SectionResearchStage(StageGraphRunner runner,
                                GenerateQueriesNode generateQueriesNode,
                                ConductSearchesNode conductSearchesNode,
                                SynthesizeFindingsNode synthesizeFindingsNode,
                                SynthesizeBackgroundNode synthesizeBackgroundNode,
                                SearchOutcomeRoutingEdge routingEdge) {
        this.runner = runner;
        this.generateQueriesNode = generateQueriesNode;
        this.conductSearchesNode = conductSearchesNode;
        this.synthesizeFindingsNode = synthesizeFindingsNode;
        this.synthesizeBackgroundNode = synthesizeBackgroundNode;
        this.routingEdge = routingEdge;
    }

    @Override
    public SectionResult research(ResearchRequest request, SectionSpec section) {
        SectionResearchState state = runner.run(RunStatus.RESEARCH, "research-" + section.index(), this::graph,
                Map.of(StateKeys.REQUEST, request, StateKeys.SECTION, section));

        SectionResult result = state.getSectionResult();
        if (result == null) {
            throw new StageFailedException(RunStatus.RESEARCH, null, ErrorKind.INTERNAL,
                    section + " finished without a result", null);
        }
        return result;
    }

    StateGraph<SectionResearchState> graph() throws GraphStateException {
        StateGraph<SectionResearchState> workflow = new StateGraph<>(SectionResearchState::new);

        workflow.addNode(GenerateQueriesNode.NAME, generateQueriesNode);
        workflow.addNode(ConductSearchesNode.NAME, conductSearchesNode);
        workflow.addNode(SynthesizeFindingsNode.NAME, synthesizeFindingsNode);
        workflow.addNode(SynthesizeBackgroundNode.NAME, synthesizeBackgroundNode);

        workflow.addEdge(START, GenerateQueriesNode.NAME);
        workflow.addEdge(GenerateQueriesNode.NAME, ConductSearchesNode.NAME);

        workflow.addConditionalEdges(
                ConductSearchesNode.NAME,
                routingEdge,
                Map.of(
                        SearchOutcomeRoutingEdge.FINDINGS, SynthesizeFindingsNode.NAME,
                        SearchOutcomeRoutingEdge.BACKGROUND, SynthesizeBackgroundNode.NAME
                )
        );

        workflow.addEdge(SynthesizeFindingsNode.NAME, END);
        workflow.addEdge(SynthesizeBackgroundNode.NAME, END);
        return workflow;
    }
}
