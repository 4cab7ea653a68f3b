package com.eainde.research.config;

import com.eainde.research.coordinator.CompletionPolicy;
import com.eainde.research.coordinator.PipelineCoordinator;
import com.eainde.research.coordinator.PipelineSettings;
import com.eainde.research.dispatch.SectionDispatcher;
import com.eainde.research.gateway.CallPolicy;
import com.eainde.research.gateway.ExternalCallGateway;
import com.eainde.research.gateway.GatewaySettings;
import com.eainde.research.gateway.ModelSettings;
import com.eainde.research.gateway.TextGenerator;
import com.eainde.research.gateway.WebSearchClient;
import com.eainde.research.gateway.langchain.ChatModelTextGenerator;
import com.eainde.research.gateway.langchain.LangChainWebSearchClient;
import com.eainde.research.repository.InMemoryPipelineRunStore;
import com.eainde.research.repository.JdbcPipelineRunStore;
import com.eainde.research.repository.PipelineRunStore;
import com.eainde.research.workflow.PlanningStage;
import com.eainde.research.workflow.ReportStage;
import com.eainde.research.workflow.SectionResearchStage;
import com.eainde.research.workflow.StageGraphRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.web.search.WebSearchEngine;
import dev.langchain4j.web.search.tavily.TavilyWebSearchEngine;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the pipeline from {@code research.*} properties. All tunables end up
 * in immutable settings objects handed to the gateway and the coordinator.
 */
@Log4j2
@Configuration
public class ResearchPipelineConfig {

    // ── Model ───────────────────────────────────────────────────────────

    @Value("${research.model.api-key:demo}")
    private String apiKey;

    @Value("${research.model.name:gpt-4o-mini}")
    private String modelName;

    @Value("${research.model.temperature:0.1}")
    private double temperature;

    // ── Search ──────────────────────────────────────────────────────────

    @Value("${research.search.tavily.api-key:}")
    private String tavilyApiKey;

    @Value("${research.search.tavily.timeout:30s}")
    private Duration tavilyTimeout;

    // ── Gateway ─────────────────────────────────────────────────────────

    @Value("${research.gateway.timeout:45s}")
    private Duration callTimeout;

    @Value("${research.gateway.max-attempts:3}")
    private int maxAttempts;

    @Value("${research.gateway.initial-backoff:1s}")
    private Duration initialBackoff;

    @Value("${research.gateway.backoff-multiplier:2.0}")
    private double backoffMultiplier;

    @Value("${research.gateway.max-backoff:30s}")
    private Duration maxBackoff;

    @Value("${research.gateway.rate-limit-backoff-factor:4.0}")
    private double rateLimitBackoffFactor;

    // ── Pipeline ────────────────────────────────────────────────────────

    @Value("${research.pipeline.max-section-count:10}")
    private int maxSectionCount;

    @Value("${research.pipeline.max-search-depth:10}")
    private int maxSearchDepth;

    @Value("${research.pipeline.concurrency-limit:3}")
    private int concurrencyLimit;

    @Value("${research.pipeline.research-stage-timeout:15m}")
    private Duration researchStageTimeout;

    @Value("${research.pipeline.min-success-fraction:1.0}")
    private double minSuccessFraction;

    @Value("${research.pipeline.max-concurrent-runs:4}")
    private int maxConcurrentRuns;

    @Value("${research.pipeline.checkpointing:true}")
    private boolean checkpointing;

    // =========================================================================
    //  Collaborators
    // =========================================================================

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Retries are disabled in the model client; the gateway owns them.
     */
    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    public ChatModel chatModel() {
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(callTimeout)
                .maxRetries(0)
                .build();
    }

    @Bean
    public TextGenerator textGenerator(ChatModel chatModel) {
        return new ChatModelTextGenerator(chatModel);
    }

    /**
     * Tavily is the default provider. Without an API key the application does
     * not start; set {@code research.search.provider=none} to run without search.
     */
    @Bean
    @ConditionalOnMissingBean(WebSearchEngine.class)
    @ConditionalOnProperty(name = "research.search.provider", havingValue = "tavily", matchIfMissing = true)
    public WebSearchEngine tavilyWebSearchEngine() {
        if (tavilyApiKey == null || tavilyApiKey.isBlank()) {
            throw new IllegalStateException("research.search.provider is tavily but research.search.tavily.api-key "
                    + "(TAVILY_API_KEY) is not set");
        }
        return TavilyWebSearchEngine.builder()
                .apiKey(tavilyApiKey)
                .timeout(tavilyTimeout)
                .build();
    }

    @Bean
    public WebSearchClient webSearchClient(ObjectProvider<WebSearchEngine> webSearchEngine) {
        WebSearchEngine engine = webSearchEngine.getIfAvailable();
        if (engine == null) {
            log.warn("Web search is disabled, every search fails as INVALID_INPUT without retries");
        } else {
            log.info("Web search engine: {}", engine.getClass().getSimpleName());
        }
        return new LangChainWebSearchClient(engine);
    }

    @Bean
    public GatewaySettings gatewaySettings() {
        CallPolicy policy = CallPolicy.builder()
                .timeout(callTimeout)
                .maxAttempts(maxAttempts)
                .initialBackoff(initialBackoff)
                .backoffMultiplier(backoffMultiplier)
                .maxBackoff(maxBackoff)
                .rateLimitBackoffFactor(rateLimitBackoffFactor)
                .build();
        return GatewaySettings.builder()
                .generateTextPolicy(policy)
                .webSearchPolicy(policy)
                .model(ModelSettings.builder()
                        .modelName(modelName)
                        .temperature(temperature)
                        .build())
                .build();
    }

    @Bean
    public ExternalCallGateway externalCallGateway(TextGenerator textGenerator,
                                                   WebSearchClient webSearchClient,
                                                   GatewaySettings gatewaySettings) {
        return new ExternalCallGateway(textGenerator, webSearchClient, gatewaySettings);
    }

    // =========================================================================
    //  Pipeline
    // =========================================================================

    @Bean
    public StageGraphRunner stageGraphRunner() {
        return new StageGraphRunner(checkpointing);
    }

    @Bean
    public SectionDispatcher sectionDispatcher(SectionResearchStage sectionResearchStage) {
        return new SectionDispatcher(sectionResearchStage);
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        return PipelineSettings.builder()
                .maxSectionCount(maxSectionCount)
                .maxSearchDepth(maxSearchDepth)
                .concurrencyLimit(concurrencyLimit)
                .researchStageTimeout(researchStageTimeout)
                .completionPolicy(CompletionPolicy.atLeast(minSuccessFraction))
                .maxConcurrentRuns(maxConcurrentRuns)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "research.store", havingValue = "jdbc", matchIfMissing = true)
    public PipelineRunStore jdbcPipelineRunStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcPipelineRunStore(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "research.store", havingValue = "memory")
    public PipelineRunStore inMemoryPipelineRunStore() {
        return new InMemoryPipelineRunStore();
    }

    @Bean
    public PipelineCoordinator pipelineCoordinator(PlanningStage planningStage,
                                                   SectionDispatcher sectionDispatcher,
                                                   ReportStage reportStage,
                                                   PipelineRunStore pipelineRunStore,
                                                   PipelineSettings pipelineSettings,
                                                   Clock clock) {
        log.info("Pipeline: concurrency {}, research timeout {}, completion policy {}",
                pipelineSettings.getConcurrencyLimit(), pipelineSettings.getResearchStageTimeout(),
                pipelineSettings.getCompletionPolicy());
        return new PipelineCoordinator(planningStage, sectionDispatcher, reportStage,
                pipelineRunStore, pipelineSettings, clock);
    }
}
