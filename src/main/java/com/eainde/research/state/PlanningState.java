package com.eainde.research.state;

import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.ResearchRequest;
import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;

public class PlanningState extends AgentState {

    public PlanningState(Map<String, Object> initData) {
        super(initData);
    }

    public ResearchRequest getRequest() {
        return this.<ResearchRequest>value(StateKeys.REQUEST).orElseThrow();
    }

    public String getTopicAnalysis() {
        return this.<String>value(StateKeys.TOPIC_ANALYSIS).orElse("");
    }

    public ResearchPlan getPlan() {
        return this.<ResearchPlan>value(StateKeys.PLAN).orElse(null);
    }
}
