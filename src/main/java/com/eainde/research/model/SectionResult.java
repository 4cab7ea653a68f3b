package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * The product of one completed Research sub-pipeline.
 *
 * @param index       section identity (position in the plan)
 * @param title       section title
 * @param content     synthesized section text
 * @param sources     de-duplicated source URLs, in first-seen order
 * @param queriesUsed the search queries the section was researched with
 */
public record SectionResult(
        @JsonProperty("index")       int index,
        @JsonProperty("title")       String title,
        @JsonProperty("content")     String content,
        @JsonProperty("sources")     List<String> sources,
        @JsonProperty("queriesUsed") List<String> queriesUsed
) implements Serializable {

    public SectionResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        queriesUsed = queriesUsed == null ? List.of() : List.copyOf(queriesUsed);
    }
}
