package com.eainde.research.nodes;

import com.eainde.research.model.SectionResult;
import com.eainde.research.state.ReportState;
import com.eainde.research.state.StateKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Report step 4: the distinct sources of all sections and the rendered
 * "Sources" block. Web sources are numbered in sorted order; anything that is
 * not a URL is listed separately.
 */
@Component
public class CompileSourcesNode extends AbstractStepNode<ReportState> {

    public static final String NAME = "compile_sources";

    public CompileSourcesNode() {
        super(NAME, StateKeys.SOURCES, StateKeys.SOURCES_SECTION);
    }

    @Override
    protected Map<String, Object> execute(ReportState state) {
        List<SectionResult> sections = state.getSectionResults();
        Set<String> distinct = new LinkedHashSet<>();
        for (SectionResult section : sections) {
            for (String source : section.sources()) {
                if (source != null && !source.isBlank()) {
                    distinct.add(source.trim());
                }
            }
        }
        List<String> sources = new ArrayList<>(distinct);

        List<String> web = sources.stream().filter(s -> s.startsWith("http")).sorted().collect(Collectors.toList());
        List<String> other = sources.stream().filter(s -> !s.startsWith("http")).sorted().collect(Collectors.toList());

        StringBuilder block = new StringBuilder("## Sources\n\n");
        if (!web.isEmpty()) {
            block.append("### Web Sources\n");
            for (int i = 0; i < web.size(); i++) {
                block.append(i + 1).append(". ").append(web.get(i)).append('\n');
            }
        }
        if (!other.isEmpty()) {
            block.append("\n### Research Sources\n");
            other.forEach(s -> block.append("- ").append(s).append('\n'));
        }
        if (sources.isEmpty()) {
            block.append("No external sources were found.\n");
        }

        int totalQueries = sections.stream().mapToInt(s -> s.queriesUsed().size()).sum();
        block.append("\n\n---\n")
                .append("*Sections researched: ").append(sections.size()).append("*\n")
                .append("*Total sources: ").append(sources.size()).append("*\n")
                .append("*Total queries executed: ").append(totalQueries).append('*');
        if (!state.getOmittedSections().isEmpty()) {
            block.append("\n*Sections omitted: ").append(String.join(", ", state.getOmittedSections())).append('*');
        }

        return Map.of(StateKeys.SOURCES, sources, StateKeys.SOURCES_SECTION, block.toString());
    }
}
