package io.github.hide212131.langchain4j.deepagents.runtime.agent;

import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import java.util.List;

/**
 * Builds runnable agents. The runtime owns the model/tool-call loop: it supplies the current workspace to
 * every tool and folds each returned delta into the workspace before the next model step.
 */
public interface AgentRuntime {

    RunnableAgent construct(String name, String systemPrompt, List<WorkspaceTool> tools);
}
