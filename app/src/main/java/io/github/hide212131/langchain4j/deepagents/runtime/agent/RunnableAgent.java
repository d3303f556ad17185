package io.github.hide212131.langchain4j.deepagents.runtime.agent;

import io.github.hide212131.langchain4j.deepagents.runtime.state.WorkspaceState;
import java.util.List;

/**
 * A fully configured agent: system prompt and tool list fixed at construction.
 */
public interface RunnableAgent {

    String name();

    List<String> toolNames();

    /**
     * Runs the agent to completion and returns the final workspace. Blocks the caller until done.
     *
     * @throws AgentRunException when the run cannot complete
     */
    WorkspaceState invoke(WorkspaceState initialState);
}
