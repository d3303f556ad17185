package io.github.hide212131.langchain4j.deepagents.runtime;

import io.github.hide212131.langchain4j.deepagents.runtime.subagent.SubAgentSpec;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import java.util.List;

/**
 * What a top-level deep agent is made of: its instructions, caller-supplied tools and sub-agent declarations.
 */
public record DeepAgentDefinition(
        String name, String instructions, List<WorkspaceTool> tools, List<SubAgentSpec> subAgents) {

    public static final String DEFAULT_NAME = "deep-agent";

    public DeepAgentDefinition {
        name = name == null || name.isBlank() ? DEFAULT_NAME : name.trim();
        instructions = instructions == null ? "" : instructions;
        tools = tools == null ? List.of() : List.copyOf(tools);
        subAgents = subAgents == null ? List.of() : List.copyOf(subAgents);
    }

    public static DeepAgentDefinition of(String instructions) {
        return new DeepAgentDefinition(DEFAULT_NAME, instructions, List.of(), List.of());
    }

    public DeepAgentDefinition withTools(List<WorkspaceTool> newTools) {
        return new DeepAgentDefinition(name, instructions, newTools, subAgents);
    }

    public DeepAgentDefinition withSubAgents(List<SubAgentSpec> newSubAgents) {
        return new DeepAgentDefinition(name, instructions, tools, newSubAgents);
    }
}
