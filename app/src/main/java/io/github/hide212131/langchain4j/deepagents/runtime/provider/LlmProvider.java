package io.github.hide212131.langchain4j.deepagents.runtime.provider;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * モデルの提供元。{@code LLM_PROVIDER} に書く値と、{@code OPENAI_MODEL} 未指定時に使うモデル名を持つ。
 */
public enum LlmProvider {
    /** {@link DryRunChatModel} による決定的な応答。API キーは不要。 */
    MOCK("mock", "dry-run", false),
    OPENAI("openai", "gpt-4o-mini", true);

    private final String wireValue;
    private final String defaultModel;
    private final boolean requiresApiKey;

    LlmProvider(String wireValue, String defaultModel, boolean requiresApiKey) {
        this.wireValue = wireValue;
        this.defaultModel = defaultModel;
        this.requiresApiKey = requiresApiKey;
    }

    public String wireValue() {
        return wireValue;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    /** 空や未設定は {@link #MOCK}。大文字小文字と前後の空白は無視する。 */
    public static LlmProvider from(String value) {
        if (value == null || value.isBlank()) {
            return MOCK;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LlmProvider provider : values()) {
            if (provider.wireValue.equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("LLM_PROVIDER の値が不正です: " + value + " (許可値: " + wireValues() + ")");
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(LlmProvider::wireValue).toList();
    }
}
