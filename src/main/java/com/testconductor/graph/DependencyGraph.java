package com.testconductor.graph;

import com.testconductor.model.Task;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A validated, acyclic view of a task list.
 *
 * Iteration order of {@link #taskIds()} is the input order of the task list;
 * the scheduler relies on it to dispatch equally-ready tasks deterministically.
 * Instances are created only by {@link DependencyGraphBuilder}.
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> adjacency;
    private final Map<String, Task>        tasks;

    DependencyGraph(Map<String, Set<String>> adjacency, Map<String, Task> tasks) {
        this.adjacency = Collections.unmodifiableMap(adjacency);
        this.tasks     = Collections.unmodifiableMap(tasks);
    }

    /** Task ids in input order. */
    public List<String> taskIds() {
        return List.copyOf(tasks.keySet());
    }

    /** The ids the given task depends on. */
    public Set<String> dependenciesOf(String taskId) {
        Set<String> deps = adjacency.get(taskId);
        if (deps == null) throw new IllegalArgumentException("Unknown task id: " + taskId);
        return deps;
    }

    public Task task(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) throw new IllegalArgumentException("Unknown task id: " + taskId);
        return task;
    }

    public boolean contains(String taskId) { return tasks.containsKey(taskId); }
    public int     size()                  { return tasks.size(); }

    /** Adjacency view: task id to the set of its dependency ids. */
    public Map<String, Set<String>> adjacency() { return adjacency; }
}
