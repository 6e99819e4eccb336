package io.taskhost.supervisor;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskhost.config.RestartPolicy;
import io.taskhost.config.SupervisorSettings;
import io.taskhost.config.TaskHostConfig;
import io.taskhost.ipc.MessageType;
import io.taskhost.ipc.ProcessWorkerLauncher;
import io.taskhost.ipc.WorkerChannel;
import io.taskhost.ipc.WorkerEvents;
import io.taskhost.ipc.WorkerLauncher;
import io.taskhost.ipc.WorkerMessage;
import io.taskhost.observability.LogLevel;
import io.taskhost.observability.SessionLog;
import io.taskhost.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the worker process, the correlation table of in-flight tasks, and the restart policy.
 *
 * <p>All state changes run on one event-loop thread: dispatch, replies, timeouts, exits and
 * restarts are serialized there, so the correlation table needs no locking. Transport threads
 * only post events onto the loop.
 *
 * <p>Every call to {@link #execute} resolves exactly once: with the worker's reply, with a
 * timeout, with an immediate unavailability result, or with a shutdown result from
 * {@link #dispose()}. Business failures never throw.
 */
public final class TaskSupervisor implements TaskExecutor, AutoCloseable {
    public static final String ERROR_UNAVAILABLE = "Worker process not available";
    public static final String ERROR_COOLDOWN = "Worker process unavailable: restart attempts exhausted (cooldown)";
    public static final String ERROR_TIMEOUT = "Task timeout";
    public static final String ERROR_SHUTDOWN = "Task executor shutting down";
    public static final int TIMEOUT_CODE = -1;

    private static final long DISPOSE_WAIT_MS = 10_000L;

    private final SupervisorSettings settings;
    private final RestartPolicy restartPolicy;
    private final WorkerLauncher launcher;
    private final SessionLog log;
    private final ScheduledThreadPoolExecutor loop;
    private final AtomicLong taskIdCounter;
    private final AtomicBoolean disposed;

    // Event-loop confined.
    private final Map<String, PendingRequest> pending;
    private WorkerChannel worker;
    private long workerGeneration;
    private ScheduledFuture<?> restartTimer;

    private volatile Thread loopThread;
    private volatile WorkerState state;
    private volatile int restartAttempts;
    private volatile CompletableFuture<Void> stateSettled;

    public TaskSupervisor(TaskHostConfig config) {
        this(config, SessionLog.create(config));
    }

    private TaskSupervisor(TaskHostConfig config, SessionLog log) {
        this(loadSettings(config, log), null, log);
    }

    /**
     * @param launcher worker launcher; {@code null} launches {@code settings.workerCommand()}
     *                 or, when that is empty, a child JVM on the current classpath
     */
    public TaskSupervisor(SupervisorSettings settings, WorkerLauncher launcher, SessionLog log) {
        this.settings = settings == null ? SupervisorSettings.defaults() : settings;
        this.restartPolicy = this.settings.restartPolicy();
        this.log = log;
        this.launcher = launcher == null ? defaultLauncher(this.settings) : launcher;
        this.loop = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "taskhost-supervisor");
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        this.loop.setRemoveOnCancelPolicy(true);
        this.loop.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.taskIdCounter = new AtomicLong(0L);
        this.disposed = new AtomicBoolean(false);
        this.pending = new HashMap<>();
        this.state = WorkerState.ABSENT;
        this.stateSettled = new CompletableFuture<>();
        log.info("Task supervisor created (defaultTimeoutMs=" + this.settings.defaultTaskTimeoutMs()
                + ", maxRestartAttempts=" + restartPolicy.maxAttempts() + ", log=" + log.path() + ")");
    }

    /**
     * Spawns the first worker. A spawn failure is logged and leaves the handle {@code ABSENT};
     * nothing retries it automatically.
     */
    public void start() {
        callOnLoop(() -> {
            if (state == WorkerState.ABSENT) {
                spawnWorker(false);
            }
            return null;
        }, null);
    }

    /**
     * Explicit reset out of {@code COOLED_DOWN} or {@code ABSENT}: clears the attempt counter
     * and spawns a fresh worker.
     *
     * @return false when the worker is already up, starting, or the supervisor is disposed
     */
    public boolean restart() {
        Boolean restarted = callOnLoop(() -> {
            if (state != WorkerState.COOLED_DOWN && state != WorkerState.ABSENT) {
                return false;
            }
            log.info("Manual worker restart requested from state " + state);
            restartAttempts = 0;
            spawnWorker(false);
            return true;
        }, false);
        return Boolean.TRUE.equals(restarted);
    }

    @Override
    public CompletableFuture<TaskResult> execute(String taskName, Object... args) {
        return executeWithOptions(taskName, TaskOptions.defaults(), args);
    }

    @Override
    public CompletableFuture<TaskResult> executeWithOptions(String taskName, TaskOptions options, Object... args) {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("task name cannot be empty");
        }
        long timeoutMs = options == null || options.timeoutMs() == null
                ? settings.defaultTaskTimeoutMs()
                : options.timeoutMs();
        if (timeoutMs <= 0L) {
            throw new IllegalArgumentException("task timeout must be > 0: " + timeoutMs);
        }
        List<JsonNode> jsonArgs = toJsonArgs(args);
        CompletableFuture<TaskResult> result = new CompletableFuture<>();
        if (!post(() -> dispatch(taskName, jsonArgs, timeoutMs, result))) {
            result.complete(TaskResult.fail(ERROR_UNAVAILABLE));
        }
        return result;
    }

    /**
     * Blocking variant of {@link #execute} for callers that want the data or an exception.
     *
     * @throws TaskExecutionException when the task resolves with a failure
     */
    public JsonNode executeAndThrow(String taskName, Object... args) {
        TaskResult result = execute(taskName, args).join();
        if (!result.success()) {
            throw new TaskExecutionException(taskName, result.error(), result.code());
        }
        return result.data();
    }

    @Override
    public boolean isAvailable() {
        return state == WorkerState.RUNNING;
    }

    public WorkerState state() {
        return state;
    }

    public int restartAttempts() {
        return restartAttempts;
    }

    public int pendingCount() {
        Integer count = callOnLoop(pending::size, 0);
        return count == null ? 0 : count;
    }

    /**
     * Blocks until the worker is running, the supervisor settles in a state that will not
     * become running on its own, or the wait runs out.
     */
    public boolean awaitAvailable(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            CompletableFuture<Void> settled = stateSettled;
            if (isAvailable()) {
                return true;
            }
            if (settled.isDone() && state != WorkerState.STARTING && state != WorkerState.RESTARTING) {
                return false;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0L) {
                return false;
            }
            try {
                settled.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return isAvailable();
            } catch (ExecutionException e) {
                return isAvailable();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return isAvailable();
            }
        }
    }

    @Override
    public List<String> getRecentLogs(int lines) {
        return log.recentLines(lines);
    }

    @Override
    public Path getLogFilePath() {
        return log.path();
    }

    /**
     * Fails every in-flight request with a shutdown result, cancels their timers and any pending
     * restart, then stops the worker. Calling it again does nothing.
     */
    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        try {
            callOnLoop(() -> {
                shutdownOnLoop();
                return null;
            }, null);
        } finally {
            loop.shutdown();
            if (Thread.currentThread() != loopThread) {
                try {
                    if (!loop.awaitTermination(DISPOSE_WAIT_MS, TimeUnit.MILLISECONDS)) {
                        loop.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    loop.shutdownNow();
                }
            }
        }
    }

    @Override
    public void close() {
        dispose();
    }

    private void dispatch(String taskName, List<JsonNode> args, long timeoutMs, CompletableFuture<TaskResult> result) {
        if (state == WorkerState.COOLED_DOWN) {
            result.complete(TaskResult.fail(ERROR_COOLDOWN));
            return;
        }
        if (state != WorkerState.RUNNING || worker == null) {
            log.warn("Rejected task " + taskName + ": worker is " + state);
            result.complete(TaskResult.fail(ERROR_UNAVAILABLE));
            return;
        }
        String taskId = "task-" + taskIdCounter.incrementAndGet() + "-" + System.currentTimeMillis();
        ScheduledFuture<?> timer = loop.schedule(() -> onTimeout(taskId), timeoutMs, TimeUnit.MILLISECONDS);
        PendingRequest request = new PendingRequest(taskId, taskName, result, timer, System.currentTimeMillis());
        pending.put(taskId, request);
        try {
            worker.send(WorkerMessage.executeTask(taskId, taskName, args));
            log.debug("Dispatched " + taskName + " (taskId=" + taskId + ", timeoutMs=" + timeoutMs + ")");
        } catch (IOException | RuntimeException e) {
            pending.remove(taskId);
            request.resolve(TaskResult.fail(ERROR_UNAVAILABLE));
            log.error("Failed to send " + taskName + " to worker (taskId=" + taskId + ")", e);
        }
    }

    private void onTimeout(String taskId) {
        PendingRequest request = pending.remove(taskId);
        if (request == null) {
            return;
        }
        request.resolve(TaskResult.fail(ERROR_TIMEOUT, TIMEOUT_CODE));
        long waitedMs = System.currentTimeMillis() - request.createdAtMs();
        log.warn("Task " + request.taskName() + " timed out after " + waitedMs + "ms (taskId=" + taskId + ")");
    }

    private void onWorkerMessage(long generation, WorkerMessage message) {
        if (generation != workerGeneration) {
            log.debug("Ignoring " + message.type().wireName() + " from replaced worker");
            return;
        }
        switch (message.type()) {
            case WORKER_READY -> onWorkerReady(message);
            case TASK_COMPLETE, TASK_ERROR -> onReply(message);
            default -> log.warn("Unexpected message type from worker: " + message.type().wireName());
        }
    }

    private void onWorkerReady(WorkerMessage message) {
        if (state != WorkerState.STARTING) {
            log.warn("Worker ready signal while " + state + ", ignored");
            return;
        }
        int previousAttempts = restartAttempts;
        restartAttempts = 0;
        setState(WorkerState.RUNNING);
        log.info("Worker process ready (pid=" + (worker == null ? message.pid() : worker.pid())
                + (previousAttempts > 0 ? ", after " + previousAttempts + " restart attempts" : "") + ")");
    }

    private void onReply(WorkerMessage message) {
        String taskId = message.taskId();
        PendingRequest request = taskId == null ? null : pending.remove(taskId);
        if (request == null) {
            log.debug("Dropping reply for unknown or expired task " + taskId);
            return;
        }
        long elapsedMs = System.currentTimeMillis() - request.createdAtMs();
        if (message.type() == MessageType.TASK_COMPLETE) {
            request.resolve(TaskResult.ok(message.result()));
            log.info("Task " + request.taskName() + " completed in " + elapsedMs + "ms (taskId=" + taskId + ")");
        } else {
            request.resolve(TaskResult.fail(message.error(), message.code()));
            log.main(LogLevel.ERROR, "Task " + request.taskName() + " failed in " + elapsedMs
                    + "ms (taskId=" + taskId + ", code=" + message.code() + "): " + message.error());
        }
    }

    private void onWorkerExit(long generation, int exitCode) {
        if (generation != workerGeneration) {
            return;
        }
        long pid = worker == null ? -1L : worker.pid();
        worker = null;
        if (state == WorkerState.TERMINATED) {
            return;
        }
        if (exitCode == 0) {
            log.info("Worker process exited normally (pid=" + pid + ")");
            setState(WorkerState.ABSENT);
            return;
        }
        log.error("Worker process exited abnormally (pid=" + pid + ", code=" + exitCode
                + ", inFlight=" + pending.size() + ")", null);
        if (state == WorkerState.COOLED_DOWN) {
            return;
        }
        scheduleRestart();
    }

    private void scheduleRestart() {
        restartAttempts = restartAttempts + 1;
        int attempt = restartAttempts;
        if (restartPolicy.exhausted(attempt)) {
            log.error("Worker restart attempts exhausted after " + restartPolicy.maxAttempts()
                    + " tries, entering cooldown", null);
            setState(WorkerState.COOLED_DOWN);
            return;
        }
        long delayMs = restartPolicy.delayMs(attempt);
        setState(WorkerState.RESTARTING);
        log.warn("Restarting worker in " + delayMs + "ms (attempt " + attempt + "/" + restartPolicy.maxAttempts() + ")");
        restartTimer = loop.schedule(() -> {
            restartTimer = null;
            if (state == WorkerState.RESTARTING) {
                spawnWorker(true);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    private void spawnWorker(boolean restarting) {
        setState(WorkerState.STARTING);
        long generation = ++workerGeneration;
        try {
            LoopEvents events = new LoopEvents(generation);
            worker = launcher.launch(events);
            events.pid = worker.pid();
            log.info("Worker process spawned (pid=" + worker.pid() + ")");
        } catch (IOException | RuntimeException e) {
            worker = null;
            log.error("Failed to start worker process", e);
            if (restarting) {
                scheduleRestart();
            } else {
                setState(WorkerState.ABSENT);
            }
        }
    }

    private void shutdownOnLoop() {
        setState(WorkerState.TERMINATED);
        if (restartTimer != null) {
            restartTimer.cancel(false);
            restartTimer = null;
        }
        List<PendingRequest> outstanding = new ArrayList<>(pending.values());
        pending.clear();
        WorkerChannel current = worker;
        worker = null;
        workerGeneration++;
        try {
            for (PendingRequest request : outstanding) {
                request.resolve(TaskResult.fail(ERROR_SHUTDOWN));
            }
        } finally {
            if (current != null) {
                current.terminate();
                log.info("Terminated worker process (pid=" + current.pid() + ")");
            }
        }
        log.info("Task supervisor disposed (" + outstanding.size() + " pending tasks failed)");
    }

    private void setState(WorkerState next) {
        WorkerState previous = state;
        state = next;
        if (previous != next) {
            log.debug("Worker state " + previous + " -> " + next);
        }
        if (next == WorkerState.STARTING || next == WorkerState.RESTARTING) {
            if (stateSettled.isDone()) {
                stateSettled = new CompletableFuture<>();
            }
        } else {
            stateSettled.complete(null);
        }
    }

    private boolean post(Runnable action) {
        try {
            loop.execute(action);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private <T> T callOnLoop(Callable<T> action, T whenClosed) {
        if (Thread.currentThread() == loopThread) {
            try {
                return action.call();
            } catch (Exception e) {
                throw new IllegalStateException("supervisor action failed", e);
            }
        }
        try {
            return loop.submit(action).get();
        } catch (RejectedExecutionException e) {
            return whenClosed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return whenClosed;
        } catch (ExecutionException e) {
            throw new IllegalStateException("supervisor action failed", e.getCause());
        }
    }

    private static List<JsonNode> toJsonArgs(Object[] args) {
        if (args == null || args.length == 0) {
            return List.of();
        }
        List<JsonNode> out = new ArrayList<>(args.length);
        for (Object arg : args) {
            out.add(Jsons.compactMapper().valueToTree(arg));
        }
        return out;
    }

    private static SupervisorSettings loadSettings(TaskHostConfig config, SessionLog log) {
        SupervisorSettings.LoadOutcome outcome = SupervisorSettings.load(config.settingsFile());
        log.info("Supervisor settings loaded from " + outcome.source());
        if (!outcome.rejectedFields().isEmpty()) {
            log.warn("Ignored invalid settings: " + outcome.rejectedFields());
        }
        return outcome.settings();
    }

    private static WorkerLauncher defaultLauncher(SupervisorSettings settings) {
        List<String> command = settings.workerCommand().isEmpty()
                ? ProcessWorkerLauncher.currentJvmCommand()
                : settings.workerCommand();
        return new ProcessWorkerLauncher(command, Map.of(), TaskHostConfig.DEFAULT_WORKER_SHUTDOWN_GRACE_MS);
    }

    private final class LoopEvents implements WorkerEvents {
        private final long generation;
        private volatile long pid = -1L;

        LoopEvents(long generation) {
            this.generation = generation;
        }

        @Override
        public void onMessage(WorkerMessage message) {
            post(() -> onWorkerMessage(generation, message));
        }

        @Override
        public void onOutput(String stream, String line) {
            post(() -> log.workerOutput(pid, stream, line));
        }

        @Override
        public void onExit(int exitCode) {
            post(() -> onWorkerExit(generation, exitCode));
        }
    }
}
