package com.eainde.research.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One web search result.
 */
public record SearchHit(
        @JsonProperty("title")   String title,
        @JsonProperty("url")     String url,
        @JsonProperty("snippet") String snippet
) implements Serializable {
}
