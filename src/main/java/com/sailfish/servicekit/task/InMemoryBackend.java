package com.sailfish.servicekit.task;

import com.sailfish.servicekit.log.Log;
import com.sailfish.servicekit.service.ServiceHost;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backend that keeps encoded messages in a bounded in-process queue drained by a
 * pool of worker threads. Nothing survives a restart; meant for tests and for
 * services that only need work moved off the request thread.
 *
 * A failing task is logged and counted, never retried.
 */
public class InMemoryBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackend.class);

    public static final String CAPACITY_KEY = "modules.task.inmemory.capacity";
    public static final String WORKERS_KEY = "modules.task.inmemory.workers";
    public static final String PUBLISH_TIMEOUT_KEY = "modules.task.inmemory.publishTimeoutMs";

    public static final int DEFAULT_CAPACITY = 64;
    public static final int DEFAULT_WORKERS = 2;
    public static final Duration DEFAULT_PUBLISH_TIMEOUT = Duration.ofSeconds(1);

    private static final long POLL_INTERVAL_MS = 100;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final TaskRunner runner;
    private final BlockingQueue<byte[]> queue;
    private final int workers;
    private final Duration publishTimeout;
    private final TaskContext rootContext;

    private final AtomicBoolean consuming = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ExecutorService workerPool;

    /**
     * Creates a backend sized from the host configuration.
     */
    public InMemoryBackend(ServiceHost host, TaskRunner runner) {
        this(runner,
                host.getConfig().getInt(CAPACITY_KEY, DEFAULT_CAPACITY),
                host.getConfig().getInt(WORKERS_KEY, DEFAULT_WORKERS),
                Duration.ofMillis(host.getConfig().getLong(PUBLISH_TIMEOUT_KEY, DEFAULT_PUBLISH_TIMEOUT.toMillis())),
                host.getLog());
    }

    public InMemoryBackend(TaskRunner runner, int capacity, int workers, Duration publishTimeout, Log taskLog) {
        this.runner = Objects.requireNonNull(runner, "runner cannot be null");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }
        this.publishTimeout = Objects.requireNonNull(publishTimeout, "publishTimeout cannot be null");
        if (publishTimeout.isNegative()) {
            throw new IllegalArgumentException("publishTimeout cannot be negative");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.workers = workers;
        this.rootContext = TaskContext.background().withLog(Objects.requireNonNull(taskLog, "taskLog cannot be null"));
        log.info("InMemoryBackend initialized with capacity={}, workers={}, publishTimeout={}", capacity, workers, publishTimeout);
    }

    /** Factory for {@link BackendRegistry#install} producing an in-memory backend that runs tasks through {@code runner}. */
    public static BackendFactory factory(TaskRunner runner) {
        Objects.requireNonNull(runner, "runner cannot be null");
        return host -> new InMemoryBackend(host, runner);
    }

    @Override
    public String name() {
        return "inmemory";
    }

    @Override
    @PostConstruct
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("InMemoryBackend cannot be restarted after stop");
        }
        log.info("InMemoryBackend started and ready to accept tasks.");
    }

    @Override
    public void enqueue(TaskContext context, TaskMessage message) throws TaskException {
        if (stopped.get()) {
            throw new TaskException("InMemoryBackend is stopped");
        }
        byte[] payload = runner.codec().encode(message);
        long waitMillis = publishTimeout.toMillis();
        if (context.remaining().isPresent()) {
            waitMillis = Math.min(waitMillis, context.remaining().get().toMillis());
        }
        boolean accepted;
        try {
            accepted = queue.offer(payload, waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskException("Interrupted while enqueuing " + message, e);
        }
        if (!accepted) {
            throw new TaskException("InMemoryBackend queue is full (" + queue.size() + " pending), dropped " + message);
        }
        // stop() may have drained the queue between the check above and the offer
        if (stopped.get()) {
            queue.remove(payload);
            throw new TaskException("InMemoryBackend is stopped, dropped " + message);
        }
    }

    @Override
    public void consume() throws TaskException {
        if (stopped.get()) {
            throw new TaskException("InMemoryBackend is stopped");
        }
        if (!consuming.compareAndSet(false, true)) {
            log.debug("InMemoryBackend dispatch loop already running");
            return;
        }
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        workerPool = pool;
        for (int i = 0; i < workers; i++) {
            pool.execute(this::drainLoop);
        }
        log.info("InMemoryBackend dispatch loop started with {} worker(s)", workers);
    }

    private void drainLoop() {
        while (!stopped.get() && !Thread.currentThread().isInterrupted()) {
            byte[] payload;
            try {
                payload = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (payload != null) {
                runOne(payload);
            }
        }
    }

    private void runOne(byte[] payload) {
        try {
            runner.run(rootContext, payload);
        } catch (Throwable t) {
            log.error("Task execution failed: {}", t.getMessage(), t);
        }
    }

    /** Messages accepted but not yet picked up by a worker. */
    public int pending() {
        return queue.size();
    }

    public boolean isConsuming() {
        return consuming.get() && !stopped.get();
    }

    @Override
    @PreDestroy
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        rootContext.cancel();
        ExecutorService pool = workerPool;
        if (pool != null) {
            shutdownExecutor(pool, SHUTDOWN_TIMEOUT_SECONDS);
        }
        int dropped = queue.size();
        queue.clear();
        if (dropped > 0) {
            log.warn("InMemoryBackend stopped with {} undelivered task(s) dropped.", dropped);
        } else {
            log.info("InMemoryBackend stopped.");
        }
    }

    private void shutdownExecutor(ExecutorService executor, long timeoutSeconds) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                List<Runnable> droppedWorkers = executor.shutdownNow();
                log.warn("InMemoryBackend workers did not terminate in {} seconds. Forced shutdown, {} worker(s) never ran.",
                        timeoutSeconds, droppedWorkers.size());
                if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.error("InMemoryBackend workers did not terminate even after forceful shutdown.");
                }
            }
        } catch (InterruptedException ie) {
            log.warn("InMemoryBackend shutdown interrupted. Forcing shutdown now.");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "task-inmemory-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
