package com.eainde.research.controller.dto;

import com.eainde.research.model.ResearchRequest;

/**
 * Body of {@code POST /research-runs}. Missing counts fall back to the
 * defaults of 5 sections and search depth 3.
 */
public record CreateResearchRunRequest(String topic, Integer sectionCount, Integer searchDepth) {

    public static final int DEFAULT_SECTION_COUNT = 5;
    public static final int DEFAULT_SEARCH_DEPTH = 3;

    public ResearchRequest toResearchRequest() {
        return ResearchRequest.of(
                topic,
                sectionCount == null ? DEFAULT_SECTION_COUNT : sectionCount,
                searchDepth == null ? DEFAULT_SEARCH_DEPTH : searchDepth);
    }
}
