package com.eainde.research.workflow;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.FinalReport;
import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.RunStatus;
import com.eainde.research.model.SectionResult;
import com.eainde.research.nodes.AbstractStepNode;
import com.eainde.research.nodes.CompileBodyNode;
import com.eainde.research.nodes.CompileSourcesNode;
import com.eainde.research.nodes.ConclusionNode;
import com.eainde.research.nodes.ExecutiveSummaryNode;
import com.eainde.research.nodes.FinalizeReportNode;
import com.eainde.research.state.ReportState;
import com.eainde.research.state.StateKeys;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Report stage graph, a linear chain:
 * {@code create_executive_summary → compile_body → create_conclusion →
 * compile_sources → finalize_report}.
 */
@Log4j2
@Component
public class ReportStage {

    private final StageGraphRunner runner;
    private final List<AbstractStepNode<ReportState>> steps;

    public ReportStage(StageGraphRunner runner,
                       ExecutiveSummaryNode executiveSummaryNode,
                       CompileBodyNode compileBodyNode,
                       ConclusionNode conclusionNode,
                       CompileSourcesNode compileSourcesNode,
                       FinalizeReportNode finalizeReportNode) {
        this.runner = runner;
        this.steps = List.of(executiveSummaryNode, compileBodyNode, conclusionNode,
                compileSourcesNode, finalizeReportNode);
    }

    /**
     * @param plan            the run's plan
     * @param results         successful section results, in any order
     * @param omittedSections titles of failed sections left out of the report
     */
    public FinalReport compile(ResearchPlan plan, List<SectionResult> results, List<String> omittedSections) {
        List<SectionResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingInt(SectionResult::index));
        log.info("Compiling report for '{}' from {} sections", plan.topic(), ordered.size());

        ReportState state = runner.run(RunStatus.REPORT, "report", this::graph, Map.of(
                StateKeys.PLAN, plan,
                StateKeys.SECTION_RESULTS, ordered,
                StateKeys.OMITTED_SECTIONS, new ArrayList<>(omittedSections)));

        FinalReport report = state.getFinalReport();
        if (report == null) {
            throw new StageFailedException(RunStatus.REPORT, null, ErrorKind.INTERNAL,
                    "Report finished without a document", null);
        }
        return report;
    }

    StateGraph<ReportState> graph() throws GraphStateException {
        StateGraph<ReportState> workflow = new StateGraph<>(ReportState::new);

        String previous = START;
        for (AbstractStepNode<ReportState> step : steps) {
            workflow.addNode(step.name(), step);
            workflow.addEdge(previous, step.name());
            previous = step.name();
        }
        workflow.addEdge(previous, END);
        return workflow;
    }
}
