package com.eainde.research.nodes;

import com.eainde.research.gateway.ExternalCallGateway;
import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;
import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.ResearchRequest;
import com.eainde.research.model.SectionSpec;
import com.eainde.research.state.PlanningState;
import com.eainde.research.state.StateKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Planning step 2: turns the topic analysis into a {@link ResearchPlan}.
 * <p>
 * The model is asked for JSON. When the answer does not parse, each non-blank
 * line is taken as a section title. Sections beyond the requested count are
 * dropped; fewer sections than requested fail the step as
 * {@link ErrorKind#MALFORMED_RESPONSE}.
 * </p>
 */
@Log4j2
@Component
public class CreatePlanNode extends AbstractStepNode<PlanningState> {

    public static final String NAME = "create_plan";

    static final String DEFAULT_METHODOLOGY =
            "Each section is researched independently through targeted web searches "
                    + "and synthesized from the sources found.";

    private final ExternalCallGateway gateway;
    private final ObjectMapper objectMapper;

    public CreatePlanNode(ExternalCallGateway gateway, ObjectMapper objectMapper) {
        super(NAME, StateKeys.PLAN);
        this.gateway = gateway;
        this.objectMapper = objectMapper;
    }

    @Override
    protected Map<String, Object> execute(PlanningState state) {
        ResearchRequest request = state.getRequest();
        String answer = gateway.generateText(NAME,
                PromptTemplates.createPlan(request.topic(), state.getTopicAnalysis(), request.sectionCount()));

        ResearchPlan parsed = parse(request.topic(), answer);
        if (parsed.sectionCount() < request.sectionCount()) {
            throw new ResearchPipelineException(ErrorKind.MALFORMED_RESPONSE,
                    "Plan has " + parsed.sectionCount() + " sections, " + request.sectionCount() + " requested");
        }

        ResearchPlan plan = new ResearchPlan(parsed.topic(), parsed.methodology(),
                parsed.sections().subList(0, request.sectionCount()));
        log.info("Planned {} sections for '{}'", plan.sectionCount(), plan.topic());
        return Map.of(StateKeys.PLAN, plan);
    }

    ResearchPlan parse(String topic, String answer) {
        String text = answer == null ? "" : answer;
        try {
            JsonNode root = objectMapper.readTree(ModelAnswers.cleanJson(text));
            if (root != null && root.isObject()) {
                return fromJson(topic, root);
            }
        } catch (JsonProcessingException e) {
            log.warn("Plan answer is not JSON, reading one title per line: {}", e.getOriginalMessage());
        }
        return fromLines(topic, text);
    }

    private ResearchPlan fromJson(String topic, JsonNode root) {
        String methodology = root.path("methodology").asText("");
        List<SectionSpec> sections = new ArrayList<>();
        for (JsonNode node : root.path("sections")) {
            String title = node.isTextual() ? node.asText() : node.path("title").asText("");
            if (title.isBlank()) {
                continue;
            }
            List<String> questions = new ArrayList<>();
            for (JsonNode question : node.path("questions")) {
                questions.add(question.asText());
            }
            sections.add(new SectionSpec(sections.size(), title.trim(), questions));
        }
        return new ResearchPlan(topic, methodology.isBlank() ? DEFAULT_METHODOLOGY : methodology, sections);
    }

    private ResearchPlan fromLines(String topic, String text) {
        List<SectionSpec> sections = new ArrayList<>();
        for (String title : ModelAnswers.listItems(text)) {
            sections.add(new SectionSpec(sections.size(), title, List.of()));
        }
        return new ResearchPlan(topic, DEFAULT_METHODOLOGY, sections);
    }
}
