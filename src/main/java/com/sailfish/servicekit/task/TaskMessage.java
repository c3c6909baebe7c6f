package com.sailfish.servicekit.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A task invocation in transport form: the function identifier and its
 * arguments as JSON trees. The {@link TaskContext} is never part of the message.
 */
public final class TaskMessage {

    private final String function;
    private final List<JsonNode> args;

    @JsonCreator
    public TaskMessage(@JsonProperty("function") String function,
                       @JsonProperty("args") List<JsonNode> args) {
        if (function == null || function.trim().isEmpty()) {
            throw new IllegalArgumentException("function cannot be blank");
        }
        this.function = function;
        this.args = args == null ? Collections.emptyList() : Collections.unmodifiableList(args);
    }

    @JsonProperty("function")
    public String getFunction() {
        return function;
    }

    @JsonProperty("args")
    public List<JsonNode> getArgs() {
        return args;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskMessage that = (TaskMessage) o;
        return function.equals(that.function) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, args);
    }

    @Override
    public String toString() {
        return "TaskMessage{function='" + function + "', args=" + args.size() + "}";
    }
}
