package io.github.hide212131.langchain4j.deepagents.runtime.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolArgumentsTest {

    @Test
    void parseReadsTypedValues() {
        ToolArguments arguments = ToolArguments.parse(
                "{\"file_path\":\"/a.txt\",\"offset\":3,\"limit\":\"10\",\"replace_all\":true}");

        assertThat(arguments.requiredString("file_path")).isEqualTo("/a.txt");
        assertThat(arguments.optionalInt("offset", 0)).isEqualTo(3);
        assertThat(arguments.optionalInt("limit", 2000)).isEqualTo(10);
        assertThat(arguments.optionalInt("missing", 7)).isEqualTo(7);
        assertThat(arguments.optionalBoolean("replace_all", false)).isTrue();
        assertThat(arguments.optionalBoolean("missing", false)).isFalse();
    }

    @Test
    void blankInputIsEmptyObject() {
        assertThat(ToolArguments.parse("").has("anything")).isFalse();
        assertThat(ToolArguments.parse(null).toJson()).isEqualTo("{}");
    }

    @Test
    void invalidInputReportsInvalidArgument() {
        assertThatThrownBy(() -> ToolArguments.parse("{not json"))
                .isInstanceOfSatisfying(WorkspaceToolException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(ToolErrorKind.INVALID_ARGUMENT));
        assertThatThrownBy(() -> ToolArguments.parse("[1,2]"))
                .isInstanceOf(WorkspaceToolException.class)
                .hasMessageContaining("JSON object");
        assertThatThrownBy(() -> ToolArguments.of(Map.of()).requiredString("file_path"))
                .hasMessageContaining("Missing required argument 'file_path'");
        assertThatThrownBy(() -> ToolArguments.of(Map.of("file_path", 3)).requiredString("file_path"))
                .hasMessageContaining("must be a string");
        assertThatThrownBy(() -> ToolArguments.of(Map.of("offset", "abc")).optionalInt("offset", 0))
                .hasMessageContaining("must be an integer");
        assertThatThrownBy(() -> ToolArguments.of(Map.of("replace_all", "maybe")).optionalBoolean("replace_all", false))
                .hasMessageContaining("must be a boolean");
    }
}
