package com.eainde.research.gateway.langchain;

import com.eainde.research.gateway.ExternalCallException;
import com.eainde.research.gateway.SearchHit;
import com.eainde.research.gateway.WebSearchClient;
import com.eainde.research.model.ErrorKind;
import dev.langchain4j.web.search.WebSearchEngine;
import dev.langchain4j.web.search.WebSearchOrganicResult;
import dev.langchain4j.web.search.WebSearchRequest;
import dev.langchain4j.web.search.WebSearchResults;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link WebSearchClient} backed by a LangChain4j {@link WebSearchEngine}.
 * Without an engine every search fails as {@link ErrorKind#INVALID_INPUT}, which
 * the gateway never retries.
 */
public class LangChainWebSearchClient implements WebSearchClient {

    private final WebSearchEngine engine;

    public LangChainWebSearchClient(WebSearchEngine engine) {
        this.engine = engine;
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        if (engine == null) {
            throw new ExternalCallException(ErrorKind.INVALID_INPUT, "No web search engine configured");
        }
        WebSearchResults results = engine.search(WebSearchRequest.builder()
                .searchTerms(query)
                .maxResults(maxResults)
                .build());
        if (results == null || results.results() == null) {
            return List.of();
        }

        List<SearchHit> hits = new ArrayList<>();
        for (WebSearchOrganicResult result : results.results()) {
            String url = result.url() == null ? null : result.url().toString();
            hits.add(new SearchHit(result.title(), url, result.snippet()));
        }
        return hits;
    }
}
