package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the Planning stage. Read-only afterwards; the order of
 * {@link #sections()} is the canonical section order of the report.
 */
public record ResearchPlan(
        @JsonProperty("topic")       String topic,
        @JsonProperty("methodology") String methodology,
        @JsonProperty("sections")    List<SectionSpec> sections
) implements Serializable {

    public ResearchPlan {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public int sectionCount() {
        return sections.size();
    }
}
