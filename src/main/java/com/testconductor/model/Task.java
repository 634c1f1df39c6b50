package com.testconductor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named unit of scheduling: an ordered list of {@link Step}s plus the ids of
 * the tasks that must complete before it may start.
 *
 * Immutable. {@code id} is not validated here; the
 * {@link com.testconductor.graph.DependencyGraphBuilder} reports a missing id as a
 * configuration error together with the other graph problems.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Task {

    private final String      id;
    private final Set<String> depends;
    private final boolean     stopOnError;
    private final List<Step>  steps;

    @JsonCreator
    public Task(@JsonProperty("id") String id,
                @JsonProperty("depends") List<String> depends,
                @JsonProperty("stopOnError") Boolean stopOnError,
                @JsonProperty("steps") List<Step> steps) {
        this.id          = id;
        this.depends     = depends != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(depends))
            : Collections.emptySet();
        this.stopOnError = stopOnError == null || stopOnError;
        this.steps       = steps != null
            ? Collections.unmodifiableList(new ArrayList<>(steps))
            : Collections.emptyList();
    }

    public static Task of(String id, List<String> depends, List<Step> steps) {
        return new Task(id, depends, null, steps);
    }

    public String      getId()         { return id; }
    public Set<String> getDepends()    { return depends; }
    public boolean     isStopOnError() { return stopOnError; }
    public List<Step>  getSteps()      { return steps; }

    /** Returns a copy of this task with a different {@code stopOnError} setting. */
    public Task withStopOnError(boolean value) {
        return new Task(id, new ArrayList<>(depends), value, steps);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', depends=" + depends + ", steps=" + steps.size() + "}";
    }
}
