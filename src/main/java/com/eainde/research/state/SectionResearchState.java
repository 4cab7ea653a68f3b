package com.eainde.research.state;

import com.eainde.research.gateway.SearchHit;
import com.eainde.research.model.ResearchRequest;
import com.eainde.research.model.SectionResult;
import com.eainde.research.model.SectionSpec;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;

/**
 * State of one section sub-pipeline. Seeded with the request and the section.
 */
public class SectionResearchState extends AgentState {

    public SectionResearchState(Map<String, Object> initData) {
        super(initData);
    }

    public ResearchRequest getRequest() {
        return this.<ResearchRequest>value(StateKeys.REQUEST).orElseThrow();
    }

    public SectionSpec getSection() {
        return this.<SectionSpec>value(StateKeys.SECTION).orElseThrow();
    }

    public List<String> getQueries() {
        return this.<List<String>>value(StateKeys.QUERIES).orElse(List.of());
    }

    public List<SearchHit> getSearchHits() {
        return this.<List<SearchHit>>value(StateKeys.SEARCH_HITS).orElse(List.of());
    }

    public SectionResult getSectionResult() {
        return this.<SectionResult>value(StateKeys.SECTION_RESULT).orElse(null);
    }
}
