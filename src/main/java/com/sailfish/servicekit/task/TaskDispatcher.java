package com.sailfish.servicekit.task;

import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;

/**
 * Producer side of the task module: validates an invocation against the registered
 * function and hands it to the current backend.
 *
 * The caller never sees the result of the task itself, only whether the backend
 * accepted the message. Failures from the backend propagate unchanged and are not retried.
 */
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final BackendRegistry backends;
    private final TaskFunctionRegistry functions;
    private final TaskCodec codec;

    public TaskDispatcher(BackendRegistry backends, TaskFunctionRegistry functions, TaskCodec codec) {
        this.backends = Objects.requireNonNull(backends, "backends cannot be null");
        this.functions = Objects.requireNonNull(functions, "functions cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    }

    /**
     * Enqueues {@code method}, which must have been registered.
     *
     * @see #enqueue(TaskContext, String, Object...)
     */
    public void enqueue(TaskContext context, Method method, Object... args) throws TaskException {
        enqueue(context, TaskFunctionRegistry.identifierOf(method), args);
    }

    /**
     * Enqueues a call of the function registered under {@code functionId}.
     *
     * @param context Producer context; a cancelled context fails fast.
     * @param functionId Identifier returned by {@link TaskFunctionRegistry#register}.
     * @param args Arguments after the context; must match the function's parameter types.
     * @throws TaskNotRegisteredException if no function is registered under {@code functionId}.
     * @throws TaskCancelledException if {@code context} is cancelled.
     * @throws IllegalArgumentException if the arguments do not match the function's parameters.
     * @throws TaskException if the backend refuses the message.
     */
    public void enqueue(TaskContext context, String functionId, Object... args) throws TaskException {
        Objects.requireNonNull(context, "context cannot be null");
        Object[] callArgs = args == null ? new Object[0] : args;
        TaskFunction function = functions.require(functionId);
        checkArguments(function, callArgs);
        context.checkActive();

        TaskMessage message = codec.toMessage(function, callArgs);
        Backend backend = backends.current();
        TaskMetrics metrics = backends.metrics();
        Timer.Sample sample = Timer.start();
        try {
            backend.enqueue(context, message);
            metrics.publishCount().increment();
            log.debug("Enqueued task '{}' on backend '{}'", functionId, backend.name());
        } catch (TaskException | RuntimeException e) {
            metrics.publishFail().increment();
            log.warn("Backend '{}' rejected task '{}': {}", backend.name(), functionId, e.getMessage());
            throw e;
        } finally {
            sample.stop(metrics.publishTime());
        }
    }

    private static void checkArguments(TaskFunction function, Object[] args) {
        List<Class<?>> types = function.getArgumentTypes();
        if (types.size() != args.length) {
            throw new IllegalArgumentException("Task '" + function.getId() + "' expects " + types.size()
                    + " argument(s), got " + args.length);
        }
        for (int i = 0; i < args.length; i++) {
            Class<?> type = types.get(i);
            Object arg = args[i];
            if (arg == null) {
                if (type.isPrimitive()) {
                    throw new IllegalArgumentException("Argument " + i + " of '" + function.getId()
                            + "' cannot be null for primitive " + type.getName());
                }
                continue;
            }
            if (!wrap(type).isInstance(arg)) {
                throw new IllegalArgumentException("Argument " + i + " of '" + function.getId() + "' must be "
                        + type.getName() + ", got " + arg.getClass().getName());
            }
        }
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        return Character.class;
    }
}
