package com.sailfish.servicekit.task;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A registered task function: a {@code void} method whose first parameter is a
 * {@link TaskContext}, bound to a target instance unless it is static.
 *
 * Instances are created by {@link TaskFunctionRegistry}, which has already
 * validated the signature.
 */
public final class TaskFunction {

    private final String id;
    private final Object target;
    private final Method method;

    TaskFunction(String id, Object target, Method method) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.method = Objects.requireNonNull(method, "method cannot be null");
        this.target = Modifier.isStatic(method.getModifiers()) ? null : target;
    }

    public String getId() {
        return id;
    }

    public Method getMethod() {
        return method;
    }

    /** Parameter types after the leading {@link TaskContext}. */
    public List<Class<?>> getArgumentTypes() {
        Class<?>[] params = method.getParameterTypes();
        return Arrays.asList(Arrays.copyOfRange(params, 1, params.length));
    }

    /** Generic parameter types after the leading {@link TaskContext}, used to decode arguments. */
    public List<Type> getGenericArgumentTypes() {
        Type[] params = method.getGenericParameterTypes();
        return Arrays.asList(Arrays.copyOfRange(params, 1, params.length));
    }

    boolean isBoundTo(Object candidate) {
        return target == candidate;
    }

    public int arity() {
        return method.getParameterCount() - 1;
    }

    /**
     * Invokes the function. Exceptions thrown by the function itself are rethrown unwrapped.
     *
     * @param context The task context passed as first argument.
     * @param args    The remaining arguments, already converted to the parameter types.
     * @throws Exception whatever the function throws.
     */
    public void invoke(TaskContext context, Object... args) throws Exception {
        Object[] callArgs = new Object[args.length + 1];
        callArgs[0] = context;
        System.arraycopy(args, 0, callArgs, 1, args.length);
        try {
            method.invoke(target, callArgs);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } catch (IllegalAccessException e) {
            throw new TaskException("Task function '" + id + "' is not accessible", e);
        }
    }

    @Override
    public String toString() {
        return "TaskFunction{" + id + "}";
    }
}
