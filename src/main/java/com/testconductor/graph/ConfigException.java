package com.testconductor.graph;

/**
 * Raised when a task list cannot be scheduled at all: a missing or duplicate id,
 * a dependency on a task that does not exist, a dependency cycle, an unreadable
 * task file or invalid scheduler options.
 *
 * Always raised before any page is opened, so a run that fails with this
 * exception has executed nothing.
 */
public class ConfigException extends RuntimeException {

    public enum Kind {
        MISSING_ID,
        DUPLICATE_ID,
        UNKNOWN_DEPENDENCY,
        CYCLIC_DEPENDENCY,
        INVALID_TASK_FILE,
        INVALID_OPTIONS
    }

    private final Kind   kind;
    private final String taskId;

    public ConfigException(Kind kind, String taskId, String message) {
        this(kind, taskId, message, null);
    }

    public ConfigException(Kind kind, String taskId, String message, Throwable cause) {
        super(message, cause);
        this.kind   = kind;
        this.taskId = taskId;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static ConfigException missingId(int index) {
        return new ConfigException(Kind.MISSING_ID, null,
            "Task at index " + index + " has no id");
    }

    public static ConfigException duplicateId(String taskId) {
        return new ConfigException(Kind.DUPLICATE_ID, taskId,
            "Duplicate task id: " + taskId);
    }

    public static ConfigException unknownDependency(String taskId, String dependency) {
        return new ConfigException(Kind.UNKNOWN_DEPENDENCY, taskId,
            "Task " + taskId + " depends on unknown task: " + dependency);
    }

    public static ConfigException cyclicDependency(String taskId) {
        return new ConfigException(Kind.CYCLIC_DEPENDENCY, taskId,
            "Circular dependency detected involving task: " + taskId);
    }

    public static ConfigException invalidTaskFile(String source, Throwable cause) {
        return new ConfigException(Kind.INVALID_TASK_FILE, null,
            "Could not read task list from " + source + ": " + cause.getMessage(), cause);
    }

    public static ConfigException invalidOptions(String message) {
        return new ConfigException(Kind.INVALID_OPTIONS, null, message);
    }

    /** The category of configuration problem. */
    public Kind getKind() { return kind; }

    /** The offending task id, or {@code null} when the problem is not tied to one task. */
    public String getTaskId() { return taskId; }
}
