package com.eainde.research.nodes;

import com.eainde.research.model.FinalReport;
import com.eainde.research.model.ReportMetadata;
import com.eainde.research.model.SectionResult;
import com.eainde.research.state.ReportState;
import com.eainde.research.state.StateKeys;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Report step 5: assembles the Markdown document and its metadata.
 */
@Component
public class FinalizeReportNode extends AbstractStepNode<ReportState> {

    public static final String NAME = "finalize_report";

    private final Clock clock;

    public FinalizeReportNode(Clock clock) {
        super(NAME, StateKeys.FINAL_REPORT);
        this.clock = clock;
    }

    @Override
    protected Map<String, Object> execute(ReportState state) {
        String topic = state.getPlan().topic();
        String markdown = "# " + topic + " - Comprehensive Research Report\n\n"
                + "## Executive Summary\n\n" + state.getExecutiveSummary() + "\n\n"
                + state.getBody() + "\n"
                + "## Conclusion\n\n" + state.getConclusion() + "\n\n"
                + state.getSourcesSection() + "\n";

        List<SectionResult> sections = state.getSectionResults();
        ReportMetadata metadata = new ReportMetadata(
                sections.size(),
                state.getOmittedSections(),
                state.getSources().size(),
                sections.stream().mapToInt(s -> s.queriesUsed().size()).sum(),
                wordCount(markdown),
                clock.instant());

        FinalReport report = new FinalReport(topic, state.getExecutiveSummary(), sections,
                state.getConclusion(), state.getSources(), markdown, metadata);
        return Map.of(StateKeys.FINAL_REPORT, report);
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
