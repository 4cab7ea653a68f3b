package com.eainde.research.nodes;

import com.eainde.research.model.SectionResult;
import com.eainde.research.state.ReportState;
import com.eainde.research.state.StateKeys;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Report step 2: table of contents, methodology and the numbered sections in
 * plan order. Deterministic.
 */
@Component
public class CompileBodyNode extends AbstractStepNode<ReportState> {

    public static final String NAME = "compile_body";

    public CompileBodyNode() {
        super(NAME, StateKeys.BODY);
    }

    @Override
    protected Map<String, Object> execute(ReportState state) {
        List<SectionResult> sections = state.getSectionResults();
        StringBuilder body = new StringBuilder("## Table of Contents\n\n");
        for (int i = 0; i < sections.size(); i++) {
            body.append(i + 1).append(". ").append(sections.get(i).title()).append('\n');
        }

        body.append("\n## Methodology\n\n").append(state.getPlan().methodology()).append("\n\n---\n");

        for (int i = 0; i < sections.size(); i++) {
            SectionResult section = sections.get(i);
            body.append("\n## ").append(i + 1).append(". ").append(section.title()).append("\n\n")
                    .append(section.content()).append("\n\n");
        }
        return Map.of(StateKeys.BODY, body.toString());
    }
}
