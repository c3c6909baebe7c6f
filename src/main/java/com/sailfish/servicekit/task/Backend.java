package com.sailfish.servicekit.task;

/**
 * Transport for task invocations between producers and a consumer-side dispatch loop,
 * possibly running in other processes.
 *
 * The registry only hands messages to {@link #enqueue}; delivery, ordering and
 * durability guarantees, if any, belong to the implementation.
 */
public interface Backend {

    String name();

    /**
     * Prepares the backend for use. Called once by the owning module on service start.
     *
     * @throws Exception if the backend cannot start.
     */
    void start() throws Exception;

    /**
     * Hands a message to the transport.
     *
     * @param context Context of the producer; may be used to bound blocking.
     * @param message The invocation to deliver.
     * @throws TaskException if the message cannot be accepted. Not retried by callers.
     */
    void enqueue(TaskContext context, TaskMessage message) throws TaskException;

    /**
     * Starts the dispatch loop that receives messages and runs them. Returns without waiting
     * for the loop to finish.
     *
     * @throws TaskException if the loop cannot be started.
     */
    void consume() throws TaskException;

    /**
     * Stops the dispatch loop and releases resources. Safe to call more than once.
     */
    void stop();
}
