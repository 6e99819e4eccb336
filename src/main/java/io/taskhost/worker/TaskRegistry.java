package io.taskhost.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Task name to handler. Built once when the worker boots and read-only afterwards, so
 * concurrent dispatch needs no locking.
 */
public final class TaskRegistry {
    private final Map<String, TaskHandler> handlers;

    public TaskRegistry(Map<String, TaskHandler> handlers) {
        LinkedHashMap<String, TaskHandler> copy = new LinkedHashMap<>();
        if (handlers != null) {
            handlers.forEach((name, handler) -> {
                if (name == null || name.isBlank() || handler == null) {
                    throw new IllegalArgumentException("task registry entry must have a name and a handler: " + name);
                }
                copy.put(name, handler);
            });
        }
        this.handlers = Collections.unmodifiableMap(copy);
    }

    public static TaskRegistry systemTasks(CommandRunner runner, WorkerLog log) {
        LinkedHashMap<String, TaskHandler> handlers = new LinkedHashMap<>();
        for (SystemTask task : SystemTask.values()) {
            handlers.put(task.taskName(), task.handler(runner, log));
        }
        return new TaskRegistry(handlers);
    }

    public Optional<TaskHandler> find(String taskName) {
        if (taskName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(taskName));
    }

    public Set<String> taskNames() {
        return handlers.keySet();
    }
}
