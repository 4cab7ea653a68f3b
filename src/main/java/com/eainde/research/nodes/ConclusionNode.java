package com.eainde.research.nodes;

import com.eainde.research.gateway.ExternalCallGateway;
import com.eainde.research.state.ReportState;
import com.eainde.research.state.StateKeys;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Report step 3: the closing section, written from all section results.
 */
@Component
public class ConclusionNode extends AbstractStepNode<ReportState> {

    public static final String NAME = "create_conclusion";

    private final ExternalCallGateway gateway;

    public ConclusionNode(ExternalCallGateway gateway) {
        super(NAME, StateKeys.CONCLUSION);
        this.gateway = gateway;
    }

    @Override
    protected Map<String, Object> execute(ReportState state) {
        String conclusion = gateway.generateText(NAME,
                PromptTemplates.conclusion(state.getPlan().topic(), state.getSectionResults()));
        return Map.of(StateKeys.CONCLUSION, ModelAnswers.requireText(NAME, conclusion));
    }
}
