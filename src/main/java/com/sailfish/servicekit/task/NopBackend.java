package com.sailfish.servicekit.task;

/**
 * Backend in place until one is installed. It accepts and discards every message:
 * {@link #enqueue} always succeeds and nothing is ever delivered.
 */
public final class NopBackend implements Backend {

    public static final NopBackend INSTANCE = new NopBackend();

    private NopBackend() {
    }

    @Override
    public String name() {
        return "nop";
    }

    @Override
    public void start() {
    }

    @Override
    public void enqueue(TaskContext context, TaskMessage message) {
    }

    @Override
    public void consume() {
    }

    @Override
    public void stop() {
    }
}
