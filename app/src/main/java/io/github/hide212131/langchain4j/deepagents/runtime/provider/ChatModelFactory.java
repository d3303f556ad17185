package io.github.hide212131.langchain4j.deepagents.runtime.provider;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.Objects;

/**
 * Creates the {@link ChatModel} adapter for the configured provider. Everything above this class talks to the
 * provider only through {@code ChatModel}.
 */
public final class ChatModelFactory {

    public ChatModel create(LlmConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        return switch (configuration.provider()) {
            case MOCK -> new DryRunChatModel();
            case OPENAI -> openAi(configuration);
        };
    }

    private ChatModel openAi(LlmConfiguration configuration) {
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(configuration.openAiApiKey())
                .modelName(configuration.modelNameOrDefault())
                .timeout(configuration.timeout());
        if (configuration.openAiBaseUrl() != null) {
            builder.baseUrl(configuration.openAiBaseUrl());
        }
        return builder.build();
    }
}
