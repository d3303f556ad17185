package io.github.hide212131.langchain4j.deepagents.runtime.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * 作業計画の 1 項目。内容の検証は行わず、呼び出し側 (モデル) を信頼する。
 * モデルが付け足す {@code id} や {@code priority} などの未知のキーは読み捨てる。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Todo(String content, TodoStatus status) {

    public Todo {
        content = content == null ? "" : content;
        Objects.requireNonNull(status, "status");
    }

    public static Todo pending(String content) {
        return new Todo(content, TodoStatus.PENDING);
    }
}
