package com.sailfish.servicekit.task;

import com.sailfish.servicekit.log.Log;
import com.sailfish.servicekit.log.LogBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Leading argument of every task function: carries cancellation, an optional
 * deadline and the logger to use while the task runs.
 *
 * Derived contexts ({@link #withDeadline}, {@link #withLog}, ...) are cancelled
 * whenever their parent is; cancelling a derived context leaves the parent untouched.
 * A derived deadline never extends the parent's.
 */
public final class TaskContext {

    private final TaskContext parent;
    private final Instant deadline;
    private final Log log;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private TaskContext(TaskContext parent, Instant deadline, Log log, Clock clock) {
        this.parent = parent;
        this.deadline = deadline;
        this.log = log;
        this.clock = clock;
    }

    /** A context that is never cancelled unless {@link #cancel()} is called, logging through the default logger. */
    public static TaskContext background() {
        return new TaskContext(null, null, LogBuilder.defaultLog(), Clock.systemUTC());
    }

    static TaskContext background(Clock clock) {
        return new TaskContext(null, null, LogBuilder.defaultLog(), clock);
    }

    public TaskContext withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline cannot be null");
        Instant effective = this.deadline != null && this.deadline.isBefore(deadline) ? this.deadline : deadline;
        return new TaskContext(this, effective, log, clock);
    }

    public TaskContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return withDeadline(clock.instant().plus(timeout));
    }

    public TaskContext withLog(Log log) {
        return new TaskContext(this, deadline, Objects.requireNonNull(log, "log cannot be null"), clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            return true;
        }
        return parent != null && parent.isCancelled();
    }

    /**
     * @throws TaskCancelledException if this context is cancelled or its deadline has passed.
     */
    public void checkActive() throws TaskCancelledException {
        if (isCancelled()) {
            throw new TaskCancelledException(deadline != null && !clock.instant().isBefore(deadline)
                    ? "Task context deadline exceeded at " + deadline
                    : "Task context cancelled");
        }
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /** Time left until the deadline, zero once it has passed, empty when there is none. */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public Log log() {
        return log;
    }
}
