package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A submitted research request. Immutable once accepted.
 *
 * @param topic        the research topic
 * @param sectionCount number of report sections the plan must contain
 * @param searchDepth  number of search queries per section, and the maximum
 *                     number of results requested per query
 */
public record ResearchRequest(
        @JsonProperty("topic")        String topic,
        @JsonProperty("sectionCount") int sectionCount,
        @JsonProperty("searchDepth")  int searchDepth
) implements Serializable {

    public static ResearchRequest of(String topic, int sectionCount, int searchDepth) {
        return new ResearchRequest(topic, sectionCount, searchDepth);
    }
}
