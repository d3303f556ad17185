package io.github.hide212131.langchain4j.deepagents.runtime;

import io.github.hide212131.langchain4j.deepagents.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.deepagents.runtime.agent.AgentRuntime;
import io.github.hide212131.langchain4j.deepagents.runtime.agent.RunnableAgent;
import io.github.hide212131.langchain4j.deepagents.runtime.filesystem.EditFileTool;
import io.github.hide212131.langchain4j.deepagents.runtime.filesystem.ListFilesTool;
import io.github.hide212131.langchain4j.deepagents.runtime.filesystem.ReadFileTool;
import io.github.hide212131.langchain4j.deepagents.runtime.filesystem.WriteFileTool;
import io.github.hide212131.langchain4j.deepagents.runtime.subagent.SubAgentRegistry;
import io.github.hide212131.langchain4j.deepagents.runtime.subagent.TaskTool;
import io.github.hide212131.langchain4j.deepagents.runtime.todo.WriteTodosTool;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolCatalog;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles deep agents: built-in workspace tools, caller tools and, when sub-agents are declared, the
 * {@code task} tool backed by an eagerly built {@link SubAgentRegistry}.
 */
public final class DeepAgentFactory {

    private final AgentRuntime runtime;
    private final WorkflowLogger logger;

    public DeepAgentFactory(AgentRuntime runtime) {
        this(runtime, new WorkflowLogger(DeepAgentFactory.class));
    }

    public DeepAgentFactory(AgentRuntime runtime, WorkflowLogger logger) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /** Fresh instances of the five workspace tools every deep agent carries. */
    public static List<WorkspaceTool> builtinTools() {
        return List.of(
                new WriteTodosTool(),
                new ReadFileTool(),
                new WriteFileTool(),
                new EditFileTool(),
                new ListFilesTool());
    }

    /**
     * @throws AgentConfigurationException when a caller tool reuses a built-in or reserved name, or two
     *     sub-agents share a name
     */
    public DeepAgent create(DeepAgentDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        ToolCatalog catalog = buildCatalog(definition.tools());
        SubAgentRegistry registry = null;
        List<WorkspaceTool> tools = new ArrayList<>(catalog.tools());
        if (!definition.subAgents().isEmpty()) {
            try {
                registry = SubAgentRegistry.create(definition.subAgents(), catalog, runtime, logger);
            } catch (IllegalArgumentException ex) {
                throw new AgentConfigurationException(ex.getMessage(), ex);
            }
            tools.add(registry.taskTool());
        }
        RunnableAgent agent = runtime.construct(definition.name(), definition.instructions(), tools);
        logger.info("Created agent {} with tools {}", agent.name(), agent.toolNames());
        return new DeepAgent(agent, catalog, registry);
    }

    private static ToolCatalog buildCatalog(List<WorkspaceTool> callerTools) {
        for (WorkspaceTool tool : callerTools) {
            if (TaskTool.TOOL_NAME.equals(tool.name())) {
                throw new AgentConfigurationException("Tool name '" + TaskTool.TOOL_NAME + "' is reserved", null);
            }
        }
        try {
            return ToolCatalog.of(builtinTools()).plusAll(callerTools);
        } catch (IllegalArgumentException ex) {
            throw new AgentConfigurationException(ex.getMessage(), ex);
        }
    }
}
