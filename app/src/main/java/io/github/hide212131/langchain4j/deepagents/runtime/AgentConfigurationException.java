package io.github.hide212131.langchain4j.deepagents.runtime;

/**
 * エージェント構成 (設定ファイル、ツール定義) の読み込みや検証に失敗した場合の例外。
 */
public class AgentConfigurationException extends RuntimeException {

    public AgentConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
