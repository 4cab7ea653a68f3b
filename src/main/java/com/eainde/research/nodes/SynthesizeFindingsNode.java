package com.eainde.research.nodes;

import com.eainde.research.gateway.ExternalCallGateway;
import com.eainde.research.gateway.SearchHit;
import com.eainde.research.model.SectionResult;
import com.eainde.research.model.SectionSpec;
import com.eainde.research.state.SectionResearchState;
import com.eainde.research.state.StateKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Research step 3a: writes the section from the search hits. Sources are the
 * distinct hit URLs in first-seen order.
 */
@Component
public class SynthesizeFindingsNode extends AbstractStepNode<SectionResearchState> {

    public static final String NAME = "synthesize_findings";

    private final ExternalCallGateway gateway;

    public SynthesizeFindingsNode(ExternalCallGateway gateway) {
        super(NAME, StateKeys.SECTION_RESULT);
        this.gateway = gateway;
    }

    @Override
    protected Map<String, Object> execute(SectionResearchState state) {
        SectionSpec section = state.getSection();
        List<SearchHit> hits = state.getSearchHits();
        String content = gateway.generateText(NAME,
                PromptTemplates.synthesizeFindings(state.getRequest().topic(), section, hits));

        SectionResult result = new SectionResult(section.index(), section.title(),
                ModelAnswers.requireText(NAME, content),
                sources(hits), state.getQueries());
        return Map.of(StateKeys.SECTION_RESULT, result);
    }

    static List<String> sources(List<SearchHit> hits) {
        Set<String> urls = new LinkedHashSet<>();
        for (SearchHit hit : hits) {
            if (hit.url() != null && !hit.url().isBlank()) {
                urls.add(hit.url().trim());
            }
        }
        return new ArrayList<>(urls);
    }
}
