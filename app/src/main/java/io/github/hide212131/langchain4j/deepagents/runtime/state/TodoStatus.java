package io.github.hide212131.langchain4j.deepagents.runtime.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Todo の状態。モデルとの入出力では小文字のワイヤ値 ({@code pending} など) を用いる。
 */
public enum TodoStatus {
    PENDING("pending"), IN_PROGRESS("in_progress"), COMPLETED("completed");

    private final String wireValue;
    private static final Map<String, TodoStatus> LOOKUP = buildLookup();

    TodoStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static TodoStatus from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status は空にできません");
        }
        TodoStatus mapped = LOOKUP.get(value.trim().toLowerCase(Locale.ROOT));
        if (mapped != null) {
            return mapped;
        }
        throw new IllegalArgumentException("不明なステータスです: " + value + " (許可値: " + wireValues() + ")");
    }

    public static List<String> wireValues() {
        return List.of(PENDING.wireValue, IN_PROGRESS.wireValue, COMPLETED.wireValue);
    }

    private static Map<String, TodoStatus> buildLookup() {
        Map<String, TodoStatus> map = new HashMap<>();
        for (TodoStatus status : values()) {
            map.put(status.wireValue, status);
            map.put(status.name().toLowerCase(Locale.ROOT), status);
        }
        return Map.copyOf(map);
    }
}
