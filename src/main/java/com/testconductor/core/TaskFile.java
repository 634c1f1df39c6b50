package com.testconductor.core;

import com.testconductor.model.Task;

import java.util.List;

/**
 * A loaded task file: the tasks plus whether they may run in parallel.
 * A file holding a bare array of tasks is parallel.
 */
public final class TaskFile {

    private final List<Task> tasks;
    private final boolean    parallel;

    public TaskFile(List<Task> tasks, boolean parallel) {
        this.tasks    = List.copyOf(tasks);
        this.parallel = parallel;
    }

    public List<Task> getTasks()   { return tasks; }
    public boolean    isParallel() { return parallel; }
}
