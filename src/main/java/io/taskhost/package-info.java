/**
 * taskhost source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskhost.Main} bootstraps the CLI; the same entry runs the worker process.</li>
 *   <li>{@code io.taskhost.supervisor.TaskSupervisor} owns the worker lifecycle, request correlation and restarts.</li>
 *   <li>{@code io.taskhost.worker.WorkerDispatcher} executes tasks inside the worker.</li>
 *   <li>{@code io.taskhost.ipc.MessageCodec} defines the line-delimited JSON pipe format.</li>
 * </ul>
 */
package io.taskhost;
