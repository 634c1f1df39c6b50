package com.testconductor.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.testconductor.graph.ConfigException;
import com.testconductor.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads task lists from JSON.
 *
 * Two layouts are accepted:
 * <pre>
 *   [ { "id": "login", "steps": [...] }, ... ]
 *
 *   { "parallel": true, "tasks": [ ... ] }
 * </pre>
 * Unknown properties are ignored; an unknown step {@code action}, a missing
 * required step field or malformed JSON is a {@link ConfigException} of kind
 * {@code INVALID_TASK_FILE}. Graph problems (ids, dependencies, cycles) are left
 * to the {@link com.testconductor.graph.DependencyGraphBuilder}.
 */
public class TaskListLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskListLoader.class);

    private final ObjectMapper mapper;
    private final ObjectReader taskListReader;

    public TaskListLoader() {
        this.mapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.taskListReader = mapper.readerFor(new TypeReference<List<Task>>() {});
    }

    public TaskFile load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            TaskFile file = read(in, path.toString());
            log.info("TaskListLoader: loaded {} task(s) from {}", file.getTasks().size(), path);
            return file;
        } catch (IOException e) {
            throw ConfigException.invalidTaskFile(path.toString(), e);
        }
    }

    public TaskFile parse(String json) {
        try {
            return fromTree(mapper.readTree(json), "inline JSON");
        } catch (IOException e) {
            throw ConfigException.invalidTaskFile("inline JSON", e);
        }
    }

    public TaskFile read(InputStream in, String source) {
        try {
            return fromTree(mapper.readTree(in), source);
        } catch (IOException e) {
            throw ConfigException.invalidTaskFile(source, e);
        }
    }

    private TaskFile fromTree(JsonNode root, String source) throws IOException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw ConfigException.invalidTaskFile(source, new IOException("empty document"));
        }
        if (root.isArray()) {
            return new TaskFile(taskListReader.readValue(root), true);
        }
        if (root.isObject() && root.has("tasks") && root.get("tasks").isArray()) {
            boolean parallel = !root.has("parallel") || root.get("parallel").asBoolean(true);
            return new TaskFile(taskListReader.readValue(root.get("tasks")), parallel);
        }
        throw ConfigException.invalidTaskFile(source,
            new IOException("expected a task array or an object with a 'tasks' array"));
    }
}
