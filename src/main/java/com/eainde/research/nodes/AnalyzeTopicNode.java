package com.eainde.research.nodes;

import com.eainde.research.gateway.ExternalCallGateway;
import com.eainde.research.state.PlanningState;
import com.eainde.research.state.StateKeys;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Planning step 1: asks the model for a structured analysis of the topic.
 */
@Component
public class AnalyzeTopicNode extends AbstractStepNode<PlanningState> {

    public static final String NAME = "analyze_topic";

    private final ExternalCallGateway gateway;

    public AnalyzeTopicNode(ExternalCallGateway gateway) {
        super(NAME, StateKeys.TOPIC_ANALYSIS);
        this.gateway = gateway;
    }

    @Override
    protected Map<String, Object> execute(PlanningState state) {
        String topic = state.getRequest().topic();
        String analysis = gateway.generateText(NAME, PromptTemplates.analyzeTopic(topic));
        return Map.of(StateKeys.TOPIC_ANALYSIS, analysis);
    }
}
