package com.sailfish.servicekit.task;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.util.Objects;

/**
 * Counters and timers recorded on the publish and execution paths of tasks.
 */
public final class TaskMetrics {

    public static final String PUBLISH_COUNT = "task.publish.count";
    public static final String PUBLISH_FAIL = "task.publish.fail";
    public static final String PUBLISH_TIME = "task.publish.time";
    public static final String EXECUTION_COUNT = "task.execution.count";
    public static final String EXECUTION_FAIL = "task.execution.fail";
    public static final String EXECUTION_TIME = "task.execution.time";

    private final Counter publishCount;
    private final Counter publishFail;
    private final Timer publishTime;
    private final Counter executionCount;
    private final Counter executionFail;
    private final Timer executionTime;

    public TaskMetrics(MeterRegistry registry) {
        Objects.requireNonNull(registry, "registry cannot be null");
        this.publishCount = Counter.builder(PUBLISH_COUNT).description("Tasks handed to the backend").register(registry);
        this.publishFail = Counter.builder(PUBLISH_FAIL).description("Tasks the backend refused").register(registry);
        this.publishTime = Timer.builder(PUBLISH_TIME).description("Time spent enqueuing a task").register(registry);
        this.executionCount = Counter.builder(EXECUTION_COUNT).description("Tasks run by a consumer").register(registry);
        this.executionFail = Counter.builder(EXECUTION_FAIL).description("Tasks that failed while running").register(registry);
        this.executionTime = Timer.builder(EXECUTION_TIME).description("Time spent running a task").register(registry);
    }

    /** Metrics bound to a registry with no backing store. */
    public static TaskMetrics noop() {
        return new TaskMetrics(new CompositeMeterRegistry());
    }

    public Counter publishCount() {
        return publishCount;
    }

    public Counter publishFail() {
        return publishFail;
    }

    public Timer publishTime() {
        return publishTime;
    }

    public Counter executionCount() {
        return executionCount;
    }

    public Counter executionFail() {
        return executionFail;
    }

    public Timer executionTime() {
        return executionTime;
    }
}
