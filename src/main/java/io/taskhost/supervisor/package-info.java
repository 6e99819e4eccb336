/**
 * Supervisor side of the worker pipe.
 *
 * <p>{@link io.taskhost.supervisor.TaskSupervisor} is meant to be created once at the
 * application root and handed to consumers as a {@link io.taskhost.supervisor.TaskExecutor};
 * {@link io.taskhost.supervisor.TaskManager} adds the typed, throwing API on top.
 */
package io.taskhost.supervisor;
