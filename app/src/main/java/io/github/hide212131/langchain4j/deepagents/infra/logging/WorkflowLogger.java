package io.github.hide212131.langchain4j.deepagents.infra.logging;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around SLF4J shared by the runtime components.
 * <p>
 * The logger name defaults to this class so that a single category can be tuned in {@code logback.xml};
 * components that need their own category pass their class explicitly.
 */
public final class WorkflowLogger {

    private final Logger logger;

    public WorkflowLogger() {
        this(WorkflowLogger.class);
    }

    public WorkflowLogger(Class<?> category) {
        this.logger = LoggerFactory.getLogger(Objects.requireNonNull(category, "category"));
    }

    public void info(String message, Object... args) {
        logger.info(message, args);
    }

    public void debug(String message, Object... args) {
        logger.debug(message, args);
    }

    public void warn(String message, Object... args) {
        logger.warn(message, args);
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }
}
