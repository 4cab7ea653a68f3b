package com.eainde.research.config;

import dev.langchain4j.web.search.WebSearchEngine;
import dev.langchain4j.web.search.tavily.TavilyWebSearchEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResearchPipelineConfigTest {

    private final ResearchPipelineConfig config = new ResearchPipelineConfig();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(config, "tavilyTimeout", Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("a configured Tavily key yields a Tavily search engine")
    void tavilyEngine() {
        ReflectionTestUtils.setField(config, "tavilyApiKey", "tvly-test-key");

        WebSearchEngine engine = config.tavilyWebSearchEngine();

        assertThat(engine).isInstanceOf(TavilyWebSearchEngine.class);
    }

    @Test
    @DisplayName("Tavily without an API key stops startup with a clear message")
    void missingKey() {
        ReflectionTestUtils.setField(config, "tavilyApiKey", "");

        assertThatThrownBy(config::tavilyWebSearchEngine)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TAVILY_API_KEY");
    }
}
