package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * The finished report artifact of a completed run.
 *
 * @param topic            research topic
 * @param executiveSummary generated executive summary
 * @param sections         section results in plan order
 * @param conclusion       generated conclusion
 * @param sources          compiled, de-duplicated source list
 * @param markdown         the rendered document
 * @param metadata         report statistics
 */
public record FinalReport(
        @JsonProperty("topic")            String topic,
        @JsonProperty("executiveSummary") String executiveSummary,
        @JsonProperty("sections")         List<SectionResult> sections,
        @JsonProperty("conclusion")       String conclusion,
        @JsonProperty("sources")          List<String> sources,
        @JsonProperty("markdown")         String markdown,
        @JsonProperty("metadata")         ReportMetadata metadata
) implements Serializable {

    public FinalReport {
        sections = sections == null ? List.of() : List.copyOf(sections);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
