package com.sailfish.servicekit.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide lookup from stable function identifiers to invokable {@link TaskFunction}s.
 *
 * A consumer that receives a serialized {@link TaskMessage} resolves its
 * function id here, so every function must be registered, on both the
 * producing and the consuming side, before a message referencing it is
 * enqueued. Registration normally happens during application startup.
 *
 * A task function:
 * <ul>
 *   <li>takes a {@link TaskContext} as its first parameter,</li>
 *   <li>returns {@code void} and reports failure by throwing,</li>
 *   <li>is not variadic.</li>
 * </ul>
 * Violations are reported as {@link TaskConfigurationException} at registration.
 */
public class TaskFunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskFunctionRegistry.class);

    private final Map<String, TaskFunction> functions = new ConcurrentHashMap<>();

    /**
     * Identifier of a method: binary name of the declaring class, {@code '#'}, method name.
     */
    public static String identifierOf(Method method) {
        Objects.requireNonNull(method, "method cannot be null");
        return method.getDeclaringClass().getName() + "#" + method.getName();
    }

    /**
     * Registers the single static method with the given name declared on {@code type}.
     *
     * @return The identifier the function is registered under.
     * @throws TaskConfigurationException if there is no such method, more than one, or it breaks the contract.
     */
    public String register(Class<?> type, String methodName) {
        Objects.requireNonNull(type, "type cannot be null");
        return register(null, findUnique(type, methodName, true));
    }

    /**
     * Registers the single instance method with the given name, bound to {@code target}.
     *
     * @return The identifier the function is registered under.
     * @throws TaskConfigurationException if there is no such method, more than one, or it breaks the contract.
     */
    public String register(Object target, String methodName) {
        Objects.requireNonNull(target, "target cannot be null");
        return register(target, findUnique(target.getClass(), methodName, false));
    }

    /**
     * Registers a static method.
     *
     * @return The identifier the function is registered under.
     */
    public String register(Method method) {
        return register(null, method);
    }

    /**
     * Registers {@code method}, bound to {@code target} when it is an instance method.
     *
     * @return The identifier the function is registered under.
     * @throws TaskConfigurationException if the method breaks the contract or its identifier
     *                                    is already bound to a different function.
     */
    public String register(Object target, Method method) {
        Objects.requireNonNull(method, "method cannot be null");
        validate(target, method);
        String id = identifierOf(method);
        try {
            method.setAccessible(true);
        } catch (RuntimeException e) {
            throw new TaskConfigurationException("Task function '" + id + "' cannot be made accessible", e);
        }
        TaskFunction candidate = new TaskFunction(id, target, method);
        TaskFunction existing = functions.putIfAbsent(id, candidate);
        if (existing != null) {
            if (existing.getMethod().equals(method) && sameTarget(existing, target, method)) {
                log.debug("Task function '{}' already registered", id);
                return id;
            }
            throw new TaskConfigurationException("Task function identifier '" + id + "' is already registered to a different function");
        }
        log.info("Registered task function '{}' with {} argument(s)", id, candidate.arity());
        return id;
    }

    public Optional<TaskFunction> lookup(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(functions.get(id));
    }

    /**
     * @throws TaskNotRegisteredException if nothing is registered under {@code id}.
     */
    public TaskFunction require(String id) throws TaskNotRegisteredException {
        TaskFunction function = id == null ? null : functions.get(id);
        if (function == null) {
            log.warn("No task function found for id: {}", id);
            throw new TaskNotRegisteredException(id);
        }
        return function;
    }

    public boolean isRegistered(String id) {
        return id != null && functions.containsKey(id);
    }

    /** Registered identifiers, sorted. */
    public Set<String> identifiers() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    private static boolean sameTarget(TaskFunction existing, Object target, Method method) {
        if (Modifier.isStatic(method.getModifiers())) {
            return true;
        }
        // instance methods are bound to one receiver for the life of the registry
        return existing.isBoundTo(target);
    }

    private static void validate(Object target, Method method) {
        String id = identifierOf(method);
        Class<?>[] params = method.getParameterTypes();
        if (params.length == 0 || !TaskContext.class.equals(params[0])) {
            throw new TaskConfigurationException("Task function '" + id + "' must take a TaskContext as its first parameter");
        }
        if (!void.class.equals(method.getReturnType())) {
            throw new TaskConfigurationException("Task function '" + id + "' must return void, found " + method.getReturnType().getName());
        }
        if (method.isVarArgs()) {
            throw new TaskConfigurationException("Task function '" + id + "' must not be variadic");
        }
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (!isStatic && target == null) {
            throw new TaskConfigurationException("Task function '" + id + "' is an instance method and needs a target");
        }
        if (!isStatic && !method.getDeclaringClass().isInstance(target)) {
            throw new TaskConfigurationException("Target " + target.getClass().getName() + " does not declare task function '" + id + "'");
        }
    }

    private static Method findUnique(Class<?> type, String methodName, boolean wantStatic) {
        if (methodName == null || methodName.trim().isEmpty()) {
            throw new IllegalArgumentException("methodName cannot be blank");
        }
        Set<Method> all = new LinkedHashSet<>();
        Collections.addAll(all, type.getDeclaredMethods());
        Collections.addAll(all, type.getMethods());
        List<Method> matches = new ArrayList<>();
        for (Method m : all) {
            if (m.getName().equals(methodName) && !m.isSynthetic() && !m.isBridge()
                    && Modifier.isStatic(m.getModifiers()) == wantStatic) {
                matches.add(m);
            }
        }
        if (matches.isEmpty()) {
            throw new TaskConfigurationException("No " + (wantStatic ? "static" : "instance") + " method '" + methodName
                    + "' on " + type.getName());
        }
        if (matches.size() > 1) {
            throw new TaskConfigurationException("Method '" + methodName + "' on " + type.getName()
                    + " is overloaded; task functions need a unique name");
        }
        return matches.get(0);
    }
}
