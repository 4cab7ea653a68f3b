package com.eainde.research.gateway;

import java.util.List;

/**
 * Web-search collaborator. Same contract as {@link TextGenerator}: one remote
 * call per invocation, no internal retries.
 */
@FunctionalInterface
public interface WebSearchClient {

    List<SearchHit> search(String query, int maxResults);
}
