package com.eainde.research.nodes;

import com.eainde.research.gateway.ExternalCallGateway;
import com.eainde.research.model.SectionSpec;
import com.eainde.research.state.SectionResearchState;
import com.eainde.research.state.StateKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Research step 1: generates up to {@code searchDepth} search queries for the
 * section. Falls back to the section title when the model returns none.
 */
@Component
public class GenerateQueriesNode extends AbstractStepNode<SectionResearchState> {

    public static final String NAME = "generate_queries";

    private final ExternalCallGateway gateway;

    public GenerateQueriesNode(ExternalCallGateway gateway) {
        super(NAME, StateKeys.QUERIES);
        this.gateway = gateway;
    }

    @Override
    protected Map<String, Object> execute(SectionResearchState state) {
        SectionSpec section = state.getSection();
        int depth = state.getRequest().searchDepth();
        String answer = gateway.generateText(NAME,
                PromptTemplates.generateQueries(state.getRequest().topic(), section, depth));

        List<String> queries = ModelAnswers.listItems(answer);
        if (queries.isEmpty()) {
            queries.add(section.title());
        }
        return Map.of(StateKeys.QUERIES, new ArrayList<>(queries.subList(0, Math.min(depth, queries.size()))));
    }
}
