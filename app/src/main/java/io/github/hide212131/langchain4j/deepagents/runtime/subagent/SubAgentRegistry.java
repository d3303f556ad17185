package io.github.hide212131.langchain4j.deepagents.runtime.subagent;

import io.github.hide212131.langchain4j.deepagents.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.deepagents.runtime.agent.AgentRuntime;
import io.github.hide212131.langchain4j.deepagents.runtime.agent.RunnableAgent;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolCatalog;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only set of child agents, each built eagerly from a {@link SubAgentSpec}.
 * <p>
 * Tool names are resolved once, here: names missing from the catalog are dropped with a warning, so dispatch
 * never meets an unresolved tool. A spec without tool names receives the whole catalog plus the
 * {@link TaskTool} bound to this registry, which lets that child delegate in turn.
 */
public final class SubAgentRegistry {

    private final List<SubAgentSpec> specs;
    private final TaskTool taskTool;
    private final Map<String, RegisteredSubAgent> agents;
    private final List<String> warnings;

    private SubAgentRegistry(
            List<SubAgentSpec> specs, ToolCatalog catalog, AgentRuntime runtime, WorkflowLogger logger) {
        this.specs = List.copyOf(specs);
        // The task tool reads the agents map only when it is executed, after construction has finished.
        this.taskTool = new TaskTool(this, logger);
        Map<String, RegisteredSubAgent> built = new LinkedHashMap<>();
        List<String> collectedWarnings = new ArrayList<>();
        for (SubAgentSpec spec : this.specs) {
            List<WorkspaceTool> tools = resolveTools(spec, catalog, collectedWarnings, logger);
            RunnableAgent agent = runtime.construct(spec.name(), spec.prompt(), tools);
            built.put(spec.name(), new RegisteredSubAgent(spec, agent));
            logger.info("Registered sub-agent {} with tools {}", spec.name(), agent.toolNames());
        }
        this.agents = Collections.unmodifiableMap(built);
        this.warnings = List.copyOf(collectedWarnings);
    }

    /**
     * @throws IllegalArgumentException when two specs share a name
     */
    public static SubAgentRegistry create(
            List<SubAgentSpec> specs, ToolCatalog catalog, AgentRuntime runtime, WorkflowLogger logger) {
        Objects.requireNonNull(specs, "specs");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(runtime, "runtime");
        Objects.requireNonNull(logger, "logger");
        List<String> seen = new ArrayList<>();
        for (SubAgentSpec spec : specs) {
            Objects.requireNonNull(spec, "spec");
            if (seen.contains(spec.name())) {
                throw new IllegalArgumentException("Duplicate sub-agent name: " + spec.name());
            }
            seen.add(spec.name());
        }
        return new SubAgentRegistry(specs, catalog, runtime, logger);
    }

    public Optional<RegisteredSubAgent> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(agents.get(name));
    }

    public List<String> names() {
        return specs.stream().map(SubAgentSpec::name).toList();
    }

    public List<SubAgentSpec> specs() {
        return specs;
    }

    /** Warnings collected while resolving tool names, one per dropped name. */
    public List<String> warnings() {
        return warnings;
    }

    /** The {@code task} tool that dispatches into this registry. */
    public TaskTool taskTool() {
        return taskTool;
    }

    private List<WorkspaceTool> resolveTools(
            SubAgentSpec spec, ToolCatalog catalog, List<String> collectedWarnings, WorkflowLogger logger) {
        if (spec.inheritsAllTools()) {
            List<WorkspaceTool> all = new ArrayList<>(catalog.tools());
            if (!catalog.contains(TaskTool.TOOL_NAME)) {
                all.add(taskTool);
            }
            return all;
        }
        List<String> requested = spec.toolNames();
        boolean delegates = requested.contains(TaskTool.TOOL_NAME) && !catalog.contains(TaskTool.TOOL_NAME);
        if (delegates) {
            requested = requested.stream().filter(toolName -> !TaskTool.TOOL_NAME.equals(toolName)).toList();
        }
        ToolCatalog.Resolution resolution = catalog.resolve(requested);
        for (String missing : resolution.missing()) {
            String warning = "Tool '" + missing + "' not found for agent '" + spec.name() + "'";
            logger.warn(warning);
            collectedWarnings.add(warning);
        }
        List<WorkspaceTool> tools = new ArrayList<>(resolution.tools());
        if (delegates) {
            tools.add(taskTool);
        }
        return tools;
    }

    public record RegisteredSubAgent(SubAgentSpec spec, RunnableAgent agent) {

        public RegisteredSubAgent {
            Objects.requireNonNull(spec, "spec");
            Objects.requireNonNull(agent, "agent");
        }
    }
}
