package io.github.hide212131.langchain4j.deepagents.runtime.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.deepagents.runtime.filesystem.ListFilesTool;
import io.github.hide212131.langchain4j.deepagents.runtime.filesystem.ReadFileTool;
import io.github.hide212131.langchain4j.deepagents.runtime.todo.WriteTodosTool;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolCatalogTest {

    @Test
    void keepsInsertionOrderAndRejectsDuplicates() {
        ToolCatalog catalog = ToolCatalog.of(List.of(new WriteTodosTool(), new ReadFileTool()));

        assertThat(catalog.names()).containsExactly("write_todos", "read_file");
        assertThat(catalog.plus(new ListFilesTool()).names()).containsExactly("write_todos", "read_file", "ls");
        assertThat(catalog.size()).isEqualTo(2);
        assertThatThrownBy(() -> catalog.plus(new ReadFileTool()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("read_file");
    }

    @Test
    void resolveReportsMissingNames() {
        ToolCatalog catalog = ToolCatalog.of(List.of(new WriteTodosTool(), new ReadFileTool()));

        ToolCatalog.Resolution resolution = catalog.resolve(List.of("read_file", "internet_search"));

        assertThat(resolution.tools()).extracting(WorkspaceTool::name).containsExactly("read_file");
        assertThat(resolution.missing()).containsExactly("internet_search");
    }
}
