package com.eainde.research.gateway.langchain;

import com.eainde.research.gateway.GenerationRequest;
import com.eainde.research.gateway.ModelSettings;
import com.eainde.research.gateway.TextGenerator;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

/**
 * {@link TextGenerator} backed by a LangChain4j {@link ChatModel}.
 * The model must be built with retries disabled.
 */
@Log4j2
public class ChatModelTextGenerator implements TextGenerator {

    private final ChatModel chatModel;

    public ChatModelTextGenerator(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String generate(GenerationRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(UserMessage.from(request.prompt()));
        ModelSettings model = request.model();
        if (model != null) {
            builder.parameters(ChatRequestParameters.builder()
                    .modelName(model.getModelName())
                    .temperature(model.getTemperature())
                    .build());
        }

        ChatResponse response = chatModel.chat(builder.build());
        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            log.warn("Model returned no text for '{}'", request.purpose());
            return "";
        }
        return response.aiMessage().text();
    }
}
