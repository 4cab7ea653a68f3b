package com.eainde.research.edges;

import com.eainde.research.state.SectionResearchState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Picks the synthesis step after {@code conduct_searches}.
 */
@Component
public class SearchOutcomeRoutingEdge implements AsyncEdgeAction<SectionResearchState> {

    public static final String FINDINGS = "findings";
    public static final String BACKGROUND = "background";

    @Override
    public CompletableFuture<String> apply(SectionResearchState state) {
        String next = state.getSearchHits().isEmpty() ? BACKGROUND : FINDINGS;
        return CompletableFuture.completedFuture(next);
    }
}
