package io.github.hide212131.langchain4j.deepagents.runtime.tool;

import dev.langchain4j.agent.tool.ToolSpecification;

/**
 * A named operation the model may call. Implementations read the workspace only through the supplied
 * {@link ToolInvocation} and never mutate it; updates travel back inside the {@link ToolResult}.
 */
public interface WorkspaceTool {

    ToolSpecification specification();

    ToolResult execute(ToolInvocation invocation);

    default String name() {
        return specification().name();
    }
}
