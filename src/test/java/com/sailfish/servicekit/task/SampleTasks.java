package com.sailfish.servicekit.task;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Task functions used across the task tests.
 */
public class SampleTasks {

    static final List<String> GREETED = new CopyOnWriteArrayList<>();
    static final Map<String, Integer> TOTALS = new ConcurrentHashMap<>();

    private final List<String> seen = new CopyOnWriteArrayList<>();

    public static void greet(TaskContext ctx, String name) {
        GREETED.add(name);
    }

    public static void total(TaskContext ctx, String key, int amount, List<Integer> more) {
        int sum = amount;
        for (Integer m : more) {
            sum += m;
        }
        TOTALS.put(key, sum);
    }

    public static void explode(TaskContext ctx, String reason) throws java.io.IOException {
        throw new java.io.IOException(reason);
    }

    public static void crash(TaskContext ctx, String reason) {
        throw new AssertionError(reason);
    }

    public void remember(TaskContext ctx, String value) {
        seen.add(value);
    }

    List<String> seen() {
        return seen;
    }

    // contract violations

    public static void noContext(String name) {
    }

    public static String returnsValue(TaskContext ctx) {
        return "x";
    }

    public static void variadic(TaskContext ctx, String... names) {
    }

    public static void overloaded(TaskContext ctx) {
    }

    public static void overloaded(TaskContext ctx, String name) {
    }

    public static void contextSecond(String name, TaskContext ctx) {
    }
}
