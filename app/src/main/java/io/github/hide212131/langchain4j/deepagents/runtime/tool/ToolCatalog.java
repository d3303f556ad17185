package io.github.hide212131.langchain4j.deepagents.runtime.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only, insertion-ordered mapping from tool name to tool. Safe to share across invocations.
 */
public final class ToolCatalog {

    private static final ToolCatalog EMPTY = new ToolCatalog(Map.of());

    private final Map<String, WorkspaceTool> tools;

    private ToolCatalog(Map<String, WorkspaceTool> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static ToolCatalog empty() {
        return EMPTY;
    }

    public static ToolCatalog of(Collection<? extends WorkspaceTool> tools) {
        return empty().plusAll(tools);
    }

    /**
     * Returns a catalog extended by {@code additional}.
     *
     * @throws IllegalArgumentException when a name is already registered
     */
    public ToolCatalog plusAll(Collection<? extends WorkspaceTool> additional) {
        Objects.requireNonNull(additional, "additional");
        Map<String, WorkspaceTool> merged = new LinkedHashMap<>(tools);
        for (WorkspaceTool tool : additional) {
            Objects.requireNonNull(tool, "tool");
            String name = tool.name();
            if (merged.putIfAbsent(name, tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + name);
            }
        }
        return new ToolCatalog(merged);
    }

    public ToolCatalog plus(WorkspaceTool tool) {
        return plusAll(List.of(tool));
    }

    public Optional<WorkspaceTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public List<WorkspaceTool> tools() {
        return List.copyOf(tools.values());
    }

    public int size() {
        return tools.size();
    }

    /**
     * Looks up each requested name; unknown names are reported rather than raised.
     */
    public Resolution resolve(Collection<String> requestedNames) {
        Objects.requireNonNull(requestedNames, "requestedNames");
        List<WorkspaceTool> resolved = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String name : requestedNames) {
            WorkspaceTool tool = name == null ? null : tools.get(name);
            if (tool == null) {
                missing.add(String.valueOf(name));
            } else if (!resolved.contains(tool)) {
                resolved.add(tool);
            }
        }
        return new Resolution(List.copyOf(resolved), List.copyOf(missing));
    }

    public record Resolution(List<WorkspaceTool> tools, List<String> missing) {
    }
}
