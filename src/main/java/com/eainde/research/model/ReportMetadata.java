package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Statistics attached to a finished report.
 *
 * @param sectionCount    number of sections in the report body
 * @param omittedSections titles of planned sections that failed and were left
 *                        out (always empty under the all-sections policy)
 * @param totalSources    number of distinct sources across all sections
 * @param totalQueries    number of search queries executed
 * @param wordCount       words in the rendered document
 * @param generatedAt     time the report was finalized
 */
public record ReportMetadata(
        @JsonProperty("sectionCount")    int sectionCount,
        @JsonProperty("omittedSections") List<String> omittedSections,
        @JsonProperty("totalSources")    int totalSources,
        @JsonProperty("totalQueries")    int totalQueries,
        @JsonProperty("wordCount")       int wordCount,
        @JsonProperty("generatedAt")     Instant generatedAt
) implements Serializable {

    public ReportMetadata {
        omittedSections = omittedSections == null ? List.of() : List.copyOf(omittedSections);
    }
}
