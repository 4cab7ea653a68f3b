package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * One planned report section.
 *
 * @param index            zero-based position in the plan; the join key for
 *                         parallel section results
 * @param title            section title
 * @param guidingQuestions questions the section research should answer
 */
public record SectionSpec(
        @JsonProperty("index")            int index,
        @JsonProperty("title")            String title,
        @JsonProperty("guidingQuestions") List<String> guidingQuestions
) implements Serializable {

    public SectionSpec {
        guidingQuestions = guidingQuestions == null ? List.of() : List.copyOf(guidingQuestions);
    }

    @Override
    public String toString() {
        return String.format("Section[%d, %s]", index, title);
    }
}
