package io.github.hide212131.langchain4j.deepagents.runtime.filesystem;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolInvocation;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolResult;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import java.util.List;

/**
 * {@code ls}: lists every path in the virtual file store as a JSON array, in insertion order.
 */
public final class ListFilesTool implements WorkspaceTool {

    public static final String TOOL_NAME = "ls";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ToolSpecification specification = ToolSpecification.builder()
            .name(TOOL_NAME)
            .description("List all files in the virtual filesystem")
            .parameters(JsonObjectSchema.builder().build())
            .build();

    @Override
    public ToolSpecification specification() {
        return specification;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        List<String> paths = VirtualFileSystem.list(invocation.state().files());
        try {
            return ToolResult.message(OBJECT_MAPPER.writeValueAsString(paths));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render file listing", ex);
        }
    }
}
