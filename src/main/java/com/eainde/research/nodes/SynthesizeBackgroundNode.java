package com.eainde.research.nodes;

import com.eainde.research.gateway.ExternalCallGateway;
import com.eainde.research.model.SectionResult;
import com.eainde.research.model.SectionSpec;
import com.eainde.research.state.SectionResearchState;
import com.eainde.research.state.StateKeys;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Research step 3b, taken when the searches found nothing: writes the section
 * from background knowledge, with an empty source list.
 */
@Component
public class SynthesizeBackgroundNode extends AbstractStepNode<SectionResearchState> {

    public static final String NAME = "synthesize_background";

    private final ExternalCallGateway gateway;

    public SynthesizeBackgroundNode(ExternalCallGateway gateway) {
        super(NAME, StateKeys.SECTION_RESULT);
        this.gateway = gateway;
    }

    @Override
    protected Map<String, Object> execute(SectionResearchState state) {
        SectionSpec section = state.getSection();
        String content = gateway.generateText(NAME,
                PromptTemplates.synthesizeBackground(state.getRequest().topic(), section));
        return Map.of(StateKeys.SECTION_RESULT,
                new SectionResult(section.index(), section.title(),
                        ModelAnswers.requireText(NAME, content), List.of(), state.getQueries()));
    }
}
