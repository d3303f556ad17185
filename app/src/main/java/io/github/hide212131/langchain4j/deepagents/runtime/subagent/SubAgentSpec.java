package io.github.hide212131.langchain4j.deepagents.runtime.subagent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of a child agent. {@code toolNames == null} grants the whole tool catalog; an empty list grants
 * no tools at all.
 */
public record SubAgentSpec(String name, String description, String prompt, List<String> toolNames) {

    public SubAgentSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("sub-agent name must not be blank");
        }
        name = name.trim();
        description = description == null ? "" : description.trim();
        prompt = Objects.requireNonNull(prompt, "prompt");
        toolNames = toolNames == null ? null : List.copyOf(new LinkedHashSet<>(toolNames));
    }

    public static SubAgentSpec withAllTools(String name, String description, String prompt) {
        return new SubAgentSpec(name, description, prompt, null);
    }

    public boolean inheritsAllTools() {
        return toolNames == null;
    }
}
