package com.sailfish.servicekit.task;

import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Consumer side of the task module: resolves a received message to its registered
 * function, converts the arguments and runs it. Backends call this from their
 * dispatch loop.
 */
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final TaskFunctionRegistry functions;
    private final TaskCodec codec;
    private final BackendRegistry backends;

    public TaskRunner(TaskFunctionRegistry functions, TaskCodec codec, BackendRegistry backends) {
        this.functions = Objects.requireNonNull(functions, "functions cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.backends = Objects.requireNonNull(backends, "backends cannot be null");
    }

    public TaskCodec codec() {
        return codec;
    }

    /**
     * Decodes and runs a message received as bytes.
     *
     * @throws TaskException if the bytes are not a valid message or the function is unknown.
     * @throws Exception whatever the task function throws.
     */
    public void run(TaskContext context, byte[] payload) throws Exception {
        run(context, codec.decode(payload));
    }

    /**
     * Runs one message. Only success or failure is observable; the function returns nothing.
     *
     * @throws TaskNotRegisteredException if the function id is unknown in this process.
     * @throws TaskCancelledException if {@code context} is cancelled before the function starts.
     * @throws Exception whatever the task function throws.
     */
    public void run(TaskContext context, TaskMessage message) throws Exception {
        Objects.requireNonNull(context, "context cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        TaskMetrics metrics = backends.metrics();
        metrics.executionCount().increment();
        Timer.Sample sample = Timer.start();
        try {
            TaskFunction function = functions.require(message.getFunction());
            Object[] args = codec.toArguments(function, message);
            context.checkActive();
            log.debug("Running task '{}'", function.getId());
            function.invoke(context.withLog(context.log().with("task", function.getId())), args);
        } catch (Exception | Error e) {
            metrics.executionFail().increment();
            throw e;
        } finally {
            sample.stop(metrics.executionTime());
        }
    }
}
