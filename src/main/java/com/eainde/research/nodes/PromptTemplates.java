package com.eainde.research.nodes;

import com.eainde.research.gateway.SearchHit;
import com.eainde.research.model.SectionResult;
import com.eainde.research.model.SectionSpec;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt texts of the generating steps.
 */
final class PromptTemplates {

    private static final int PREVIEW_CHARS = 300;

    private PromptTemplates() {
    }

    static String analyzeTopic(String topic) {
        return """
                Analyze this research topic and identify its key aspects:

                Topic: %s

                Consider:
                - What are the main subtopics or dimensions?
                - What questions should a comprehensive report answer?
                - What methodology would be most appropriate?

                Provide a short, structured analysis.
                """.formatted(topic);
    }

    static String createPlan(String topic, String analysis, int sectionCount) {
        return """
                Create a research plan for the topic below.

                Topic: %s

                Topic analysis:
                %s

                Answer with JSON only, in exactly this shape:
                {"methodology": "<how the research is conducted>",
                 "sections": [{"title": "<section title>", "questions": ["<guiding question>"]}]}

                The plan must contain exactly %d sections that are distinct, non-overlapping
                and ordered logically.
                """.formatted(topic, analysis, sectionCount);
    }

    static String generateQueries(String topic, SectionSpec section, int queryCount) {
        return """
                Generate %d specific, diverse search queries for researching this section:

                Section: %s
                Main Topic: %s
                Guiding questions: %s

                Return only the queries, one per line, without numbers or bullets.
                """.formatted(queryCount, section.title(), topic, String.join("; ", section.guidingQuestions()));
    }

    static String synthesizeFindings(String topic, SectionSpec section, List<SearchHit> hits) {
        String results = hits.stream()
                .map(h -> "Title: " + h.title() + "\nSource: " + h.url() + "\nContent: " + nullToEmpty(h.snippet()))
                .collect(Collectors.joining("\n\n"));
        return """
                Write a well-researched report section based on the search results below.

                Section Title: %s
                Main Topic: %s

                SEARCH RESULTS:
                %s

                Use markdown subsections, cite specific findings and stay objective.
                """.formatted(section.title(), topic, results);
    }

    static String synthesizeBackground(String topic, SectionSpec section) {
        return """
                No search results were found for this report section. Write the section from
                general background knowledge and state clearly that it is not based on fresh sources.

                Section Title: %s
                Main Topic: %s
                Guiding questions: %s
                """.formatted(section.title(), topic, String.join("; ", section.guidingQuestions()));
    }

    static String executiveSummary(String topic, List<SectionResult> sections) {
        String previews = sections.stream()
                .map(s -> "**" + s.title() + "**: " + preview(s.content()))
                .collect(Collectors.joining("\n\n"));
        return """
                Create an executive summary for this research report.

                Topic: %s
                Number of sections: %d

                SECTION CONTENT PREVIEWS:
                %s
                """.formatted(topic, sections.size(), previews);
    }

    static String conclusion(String topic, List<SectionResult> sections) {
        String keyPoints = sections.stream()
                .map(s -> "- " + s.title() + ": " + preview(s.content()))
                .collect(Collectors.joining("\n"));
        return """
                Write a conclusion for this research report that connects the findings of
                all sections and suggests areas for future research.

                Topic: %s

                KEY FINDINGS FROM SECTIONS:
                %s
                """.formatted(topic, keyPoints);
    }

    private static String preview(String content) {
        String text = nullToEmpty(content);
        return text.length() <= PREVIEW_CHARS ? text : text.substring(0, PREVIEW_CHARS) + "...";
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
