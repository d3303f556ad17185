package io.github.hide212131.langchain4j.deepagents.runtime;

import io.github.hide212131.langchain4j.deepagents.runtime.agent.RunnableAgent;
import io.github.hide212131.langchain4j.deepagents.runtime.state.WorkspaceState;
import io.github.hide212131.langchain4j.deepagents.runtime.subagent.SubAgentRegistry;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolCatalog;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A constructed top-level agent. Immutable and shareable: every {@link #run(String)} starts from its own fresh
 * workspace.
 */
public final class DeepAgent {

    private final RunnableAgent agent;
    private final ToolCatalog catalog;
    private final SubAgentRegistry registry;

    DeepAgent(RunnableAgent agent, ToolCatalog catalog, SubAgentRegistry registry) {
        this.agent = Objects.requireNonNull(agent, "agent");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.registry = registry;
    }

    public WorkspaceState run(String task) {
        return invoke(WorkspaceState.forUserMessage(task, List.of(), Map.of()));
    }

    public WorkspaceState invoke(WorkspaceState initialState) {
        return agent.invoke(initialState);
    }

    public String name() {
        return agent.name();
    }

    public List<String> toolNames() {
        return agent.toolNames();
    }

    /** Built-in and caller-supplied tools, without the {@code task} tool. */
    public ToolCatalog catalog() {
        return catalog;
    }

    public Optional<SubAgentRegistry> subAgents() {
        return Optional.ofNullable(registry);
    }

    /** Registration warnings, for example tool names a sub-agent asked for that do not exist. */
    public List<String> warnings() {
        return registry == null ? List.of() : registry.warnings();
    }
}
