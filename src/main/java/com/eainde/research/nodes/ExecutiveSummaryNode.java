package com.eainde.research.nodes;

import com.eainde.research.gateway.ExternalCallGateway;
import com.eainde.research.state.ReportState;
import com.eainde.research.state.StateKeys;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Report step 1: summarizes all section results into the executive summary.
 * A blank answer fails the step as {@link com.eainde.research.model.ErrorKind#MALFORMED_RESPONSE}.
 */
@Component
public class ExecutiveSummaryNode extends AbstractStepNode<ReportState> {

    public static final String NAME = "create_executive_summary";

    private final ExternalCallGateway gateway;

    public ExecutiveSummaryNode(ExternalCallGateway gateway) {
        super(NAME, StateKeys.EXECUTIVE_SUMMARY);
        this.gateway = gateway;
    }

    @Override
    protected Map<String, Object> execute(ReportState state) {
        String summary = gateway.generateText(NAME,
                PromptTemplates.executiveSummary(state.getPlan().topic(), state.getSectionResults()));
        return Map.of(StateKeys.EXECUTIVE_SUMMARY, ModelAnswers.requireText(NAME, summary));
    }
}
