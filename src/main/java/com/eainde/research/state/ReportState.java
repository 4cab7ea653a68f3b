package com.eainde.research.state;

import com.eainde.research.model.FinalReport;
import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.SectionResult;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;

/**
 * The report draft. Seeded with the plan and the successful section results in
 * plan order; each remaining field is written by exactly one report step.
 */
public class ReportState extends AgentState {

    public ReportState(Map<String, Object> initData) {
        super(initData);
    }

    public ResearchPlan getPlan() {
        return this.<ResearchPlan>value(StateKeys.PLAN).orElseThrow();
    }

    public List<SectionResult> getSectionResults() {
        return this.<List<SectionResult>>value(StateKeys.SECTION_RESULTS).orElse(List.of());
    }

    public List<String> getOmittedSections() {
        return this.<List<String>>value(StateKeys.OMITTED_SECTIONS).orElse(List.of());
    }

    public String getExecutiveSummary() {
        return this.<String>value(StateKeys.EXECUTIVE_SUMMARY).orElse("");
    }

    public String getBody() {
        return this.<String>value(StateKeys.BODY).orElse("");
    }

    public String getConclusion() {
        return this.<String>value(StateKeys.CONCLUSION).orElse("");
    }

    public List<String> getSources() {
        return this.<List<String>>value(StateKeys.SOURCES).orElse(List.of());
    }

    public String getSourcesSection() {
        return this.<String>value(StateKeys.SOURCES_SECTION).orElse("");
    }

    public FinalReport getFinalReport() {
        return this.<FinalReport>value(StateKeys.FINAL_REPORT).orElse(null);
    }
}
