package com.eainde.research.nodes;

import com.eainde.research.gateway.ExternalCallGateway;
import com.eainde.research.gateway.SearchHit;
import com.eainde.research.state.SectionResearchState;
import com.eainde.research.state.StateKeys;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Research step 2: runs every generated query through the web-search gateway,
 * requesting {@code searchDepth} results per query. A query whose search fails
 * after the gateway's retries fails the step.
 */
@Log4j2
@Component
public class ConductSearchesNode extends AbstractStepNode<SectionResearchState> {

    public static final String NAME = "conduct_searches";

    private final ExternalCallGateway gateway;

    public ConductSearchesNode(ExternalCallGateway gateway) {
        super(NAME, StateKeys.SEARCH_HITS);
        this.gateway = gateway;
    }

    @Override
    protected Map<String, Object> execute(SectionResearchState state) {
        int maxResults = state.getRequest().searchDepth();
        List<String> queries = state.getQueries();
        List<SearchHit> hits = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            String query = queries.get(i);
            log.debug("Search {}/{}: {}", i + 1, queries.size(), query);
            hits.addAll(gateway.search(query, maxResults));
        }
        log.info("{} queries returned {} hits", queries.size(), hits.size());
        return Map.of(StateKeys.SEARCH_HITS, hits);
    }
}
