package io.github.hide212131.langchain4j.deepagents.runtime.agent;

/**
 * An agent run could not complete (model failure, step ceiling reached).
 */
public class AgentRunException extends RuntimeException {

    public AgentRunException(String message) {
        super(message);
    }

    public AgentRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
