package com.testconductor.graph;

import com.testconductor.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a task list into a {@link DependencyGraph}.
 *
 * Checks, in order: every task has an id, ids are unique, every dependency
 * names a task in the same list, and the dependency relation is acyclic.
 * The first problem found is raised as a {@link ConfigException}; nothing is
 * executed and nothing is mutated.
 *
 * Cycle detection is a depth-first search with three-color marking. Reaching a
 * task that is still in progress is a back edge, and the task whose traversal
 * found it is reported.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private enum Mark { UNVISITED, IN_PROGRESS, DONE }

    public DependencyGraph build(List<Task> tasks) {
        if (tasks == null) throw ConfigException.invalidOptions("Task list must not be null");

        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        Map<String, Task>        byId      = new LinkedHashMap<>();

        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            if (task == null || task.getId() == null || task.getId().isBlank()) {
                throw ConfigException.missingId(i);
            }
            if (byId.containsKey(task.getId())) {
                throw ConfigException.duplicateId(task.getId());
            }
            byId.put(task.getId(), task);
            adjacency.put(task.getId(), task.getDepends());
        }

        for (Task task : byId.values()) {
            for (String dep : task.getDepends()) {
                if (!byId.containsKey(dep)) {
                    throw ConfigException.unknownDependency(task.getId(), dep);
                }
            }
        }

        Map<String, Mark> marks = new HashMap<>();
        for (String id : adjacency.keySet()) {
            if (marks.getOrDefault(id, Mark.UNVISITED) == Mark.UNVISITED) {
                visit(id, adjacency, marks);
            }
        }

        log.debug("DependencyGraphBuilder: validated {} task(s)", byId.size());
        return new DependencyGraph(adjacency, byId);
    }

    /** Iterative so that long chains cannot exhaust the call stack. */
    private void visit(String root, Map<String, Set<String>> adjacency, Map<String, Mark> marks) {
        Deque<Frame> stack = new ArrayDeque<>();
        marks.put(root, Mark.IN_PROGRESS);
        stack.push(new Frame(root, adjacency.get(root).iterator()));

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.deps.hasNext()) {
                marks.put(top.id, Mark.DONE);
                stack.pop();
                continue;
            }
            String dep  = top.deps.next();
            Mark   mark = marks.getOrDefault(dep, Mark.UNVISITED);
            if (mark == Mark.IN_PROGRESS) {
                throw ConfigException.cyclicDependency(top.id);
            }
            if (mark == Mark.UNVISITED) {
                marks.put(dep, Mark.IN_PROGRESS);
                stack.push(new Frame(dep, adjacency.get(dep).iterator()));
            }
        }
    }

    /** A task on the DFS path and the dependencies still to explore from it. */
    private static final class Frame {
        final String           id;
        final Iterator<String> deps;

        Frame(String id, Iterator<String> deps) {
            this.id   = id;
            this.deps = deps;
        }
    }
}
