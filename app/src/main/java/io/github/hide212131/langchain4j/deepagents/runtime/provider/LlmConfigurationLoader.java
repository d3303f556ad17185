package io.github.hide212131.langchain4j.deepagents.runtime.provider;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.hide212131.langchain4j.deepagents.runtime.agent.ToolLoopAgentRuntime;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * 環境変数を優先し、未設定の場合のみ .env をフォールバックして LLM 設定を解決する。
 */
public final class LlmConfigurationLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_BASE_URL = "OPENAI_BASE_URL";
    static final String ENV_OPENAI_MODEL = "OPENAI_MODEL";
    static final String ENV_OPENAI_TIMEOUT_SECONDS = "OPENAI_TIMEOUT_SECONDS";
    static final String ENV_MAX_STEPS = "DEEP_AGENT_MAX_STEPS";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public LlmConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    LlmConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public LlmConfiguration load() {
        return load(null);
    }

    public LlmConfiguration load(LlmProvider overrideProvider) {
        LlmProvider provider = overrideProvider != null ? overrideProvider : resolveProvider();
        String apiKey = trimToNull(resolveWithPriority(ENV_OPENAI_API_KEY));
        String baseUrl = trimToNull(resolveWithPriority(ENV_OPENAI_BASE_URL));
        String model = trimToNull(resolveWithPriority(ENV_OPENAI_MODEL));

        if (provider.requiresApiKey() && apiKey == null) {
            throw new IllegalStateException(
                    "LLM_PROVIDER=" + provider.wireValue() + " の場合、OPENAI_API_KEY が必須です");
        }

        return new LlmConfiguration(provider, apiKey, baseUrl, model, resolveTimeout(), resolveMaxSteps());
    }

    private LlmProvider resolveProvider() {
        return LlmProvider.from(resolveWithPriority(ENV_LLM_PROVIDER));
    }

    private Duration resolveTimeout() {
        long seconds = positiveNumber(ENV_OPENAI_TIMEOUT_SECONDS, LlmConfiguration.DEFAULT_TIMEOUT.toSeconds());
        return Duration.ofSeconds(seconds);
    }

    private int resolveMaxSteps() {
        long steps = positiveNumber(ENV_MAX_STEPS, ToolLoopAgentRuntime.DEFAULT_MAX_STEPS);
        if (steps > Integer.MAX_VALUE) {
            throw new IllegalStateException(ENV_MAX_STEPS + " が大きすぎます: " + steps);
        }
        return (int) steps;
    }

    private long positiveNumber(String key, long defaultValue) {
        String raw = trimToNull(resolveWithPriority(key));
        if (raw == null) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(key + " は正の整数で指定してください: " + raw, ex);
        }
        if (value <= 0) {
            throw new IllegalStateException(key + " は 1 以上で指定してください: " + raw);
        }
        return value;
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
