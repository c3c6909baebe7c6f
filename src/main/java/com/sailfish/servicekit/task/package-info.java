/**
 * Asynchronous task module.
 *
 * <p>A service constructs one {@link com.sailfish.servicekit.task.BackendRegistry},
 * registers its task functions with a {@link com.sailfish.servicekit.task.TaskFunctionRegistry},
 * installs a backend through {@link com.sailfish.servicekit.task.TaskModule#newModule}
 * and enqueues work with a {@link com.sailfish.servicekit.task.TaskDispatcher}.
 * Backends deliver messages to a {@link com.sailfish.servicekit.task.TaskRunner}
 * on the consuming side.
 *
 * <pre>
 *   public final class Emails {
 *       public static void send(TaskContext ctx, String address) throws IOException { ... }
 *   }
 *
 *   String id = functions.register(Emails.class, "send");
 *   dispatcher.enqueue(TaskContext.background(), id, "ops@example.com");
 * </pre>
 */
package com.sailfish.servicekit.task;
