package io.github.hide212131.langchain4j.deepagents.runtime.subagent;

import io.github.hide212131.langchain4j.deepagents.runtime.AgentConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * YAML からサブエージェント定義を読み込む。
 * <p>
 * 次のどちらの形式も受け付ける。
 * <pre>
 * subagents:
 *   - name: research-agent
 *     description: 調査担当
 *     prompt: You are a dedicated researcher.
 *     tools: [read_file, write_file]
 * </pre>
 * またはトップレベルのリスト。{@code tools} を省略した場合は全ツールを継承する。
 */
public final class SubAgentSpecLoader {

    private static final Set<String> ALLOWED_KEYS = Set.of("name", "description", "prompt", "tools");

    private final Yaml yaml = new Yaml();

    public LoadResult load(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new AgentConfigurationException("サブエージェント定義ファイルが存在しません: " + file, null);
        }
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
        } catch (IOException ex) {
            throw new AgentConfigurationException("サブエージェント定義ファイルの読み込みに失敗しました: " + file, ex);
        }
    }

    public LoadResult parse(String content, String source) {
        Object root;
        try {
            root = yaml.load(content);
        } catch (YAMLException ex) {
            throw new AgentConfigurationException("YAML の解析に失敗しました: " + source, ex);
        }
        if (root == null) {
            return new LoadResult(List.of(), List.of());
        }
        Object entries = root instanceof Map<?, ?> map ? map.get("subagents") : root;
        if (entries == null) {
            return new LoadResult(List.of(), List.of());
        }
        if (!(entries instanceof List<?> list)) {
            throw new AgentConfigurationException("subagents はリストで指定してください: " + source, null);
        }
        List<SubAgentSpec> specs = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int index = 0;
        for (Object entry : list) {
            index++;
            if (!(entry instanceof Map<?, ?> values)) {
                throw new AgentConfigurationException(
                        source + " の " + index + " 番目の要素がマッピングではありません", null);
            }
            specs.add(toSpec(values, source, index, warnings));
        }
        return new LoadResult(List.copyOf(specs), List.copyOf(warnings));
    }

    private SubAgentSpec toSpec(Map<?, ?> values, String source, int index, List<String> warnings) {
        String name = stringValue(values.get("name"));
        String prompt = stringValue(values.get("prompt"));
        if (name == null || name.isBlank()) {
            throw new AgentConfigurationException(source + " の " + index + " 番目の要素に name がありません", null);
        }
        if (prompt == null) {
            throw new AgentConfigurationException("サブエージェント " + name + " に prompt がありません: " + source, null);
        }
        for (Object key : values.keySet()) {
            if (!ALLOWED_KEYS.contains(String.valueOf(key))) {
                warnings.add("Unknown key '" + key + "' in sub-agent " + name + " (" + source + ")");
            }
        }
        return new SubAgentSpec(name, stringValue(values.get("description")), prompt, toolNames(values, name, source));
    }

    private List<String> toolNames(Map<?, ?> values, String name, String source) {
        if (!values.containsKey("tools") || values.get("tools") == null) {
            return null;
        }
        Object tools = values.get("tools");
        if (!(tools instanceof List<?> list)) {
            throw new AgentConfigurationException("サブエージェント " + name + " の tools はリストで指定してください: " + source, null);
        }
        return list.stream().map(String::valueOf).map(String::trim).filter(value -> !value.isEmpty()).toList();
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    public record LoadResult(List<SubAgentSpec> specs, List<String> warnings) {}
}
