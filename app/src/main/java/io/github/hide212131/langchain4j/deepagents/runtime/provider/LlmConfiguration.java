package io.github.hide212131.langchain4j.deepagents.runtime.provider;

import java.time.Duration;
import java.util.Objects;

/** LLM プロバイダ切替とエージェント実行に必要な設定値。 */
public record LlmConfiguration(
        LlmProvider provider,
        String openAiApiKey,
        String openAiBaseUrl,
        String openAiModel,
        Duration timeout,
        int maxSteps) {

        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private static final int MASK_THRESHOLD = 8;
    private static final int MASK_SUFFIX_LENGTH = 4;

    public LlmConfiguration {
        Objects.requireNonNull(provider, "provider");
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps は 1 以上で指定してください: " + maxSteps);
        }
    }

    public static LlmConfiguration mock(int maxSteps) {
        return new LlmConfiguration(LlmProvider.MOCK, null, null, null, DEFAULT_TIMEOUT, maxSteps);
    }

    public String modelNameOrDefault() {
        return openAiModel == null ? provider.defaultModel() : openAiModel;
    }

    public LlmConfiguration withMaxSteps(int newMaxSteps) {
        return new LlmConfiguration(provider, openAiApiKey, openAiBaseUrl, openAiModel, timeout, newMaxSteps);
    }

    public String maskedApiKey() {
        if (openAiApiKey == null || openAiApiKey.isBlank()) {
            return "(none)";
        }
        if (openAiApiKey.length() <= MASK_THRESHOLD) {
            return "****";
        }
        String last = openAiApiKey.substring(openAiApiKey.length() - MASK_SUFFIX_LENGTH);
        return "****" + last;
    }
}
