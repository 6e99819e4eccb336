package io.taskhost.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskhost.ipc.MessageType;
import io.taskhost.ipc.WorkerMessage;
import io.taskhost.util.Jsons;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Turns inbound {@code execute-task} messages into handler invocations and emits exactly one
 * {@code task-complete} or {@code task-error} reply per request.
 *
 * <p>There is no queue and no concurrency cap: every dispatch starts immediately on its own
 * thread, so commands received back to back run side by side.
 */
public final class WorkerDispatcher implements AutoCloseable {
    private static final AtomicLong THREAD_SEQ = new AtomicLong(0L);

    private final TaskRegistry registry;
    private final ReplySink replies;
    private final WorkerLog log;
    private final Consumer<Throwable> fatalHandler;
    private final ExecutorService executor;

    public WorkerDispatcher(TaskRegistry registry, ReplySink replies, WorkerLog log, Consumer<Throwable> fatalHandler) {
        this(registry, replies, log, fatalHandler, Executors.newCachedThreadPool(taskThreads()));
    }

    WorkerDispatcher(
            TaskRegistry registry,
            ReplySink replies,
            WorkerLog log,
            Consumer<Throwable> fatalHandler,
            ExecutorService executor
    ) {
        this.registry = registry;
        this.replies = replies;
        this.log = log;
        this.fatalHandler = fatalHandler;
        this.executor = executor;
    }

    public void dispatch(WorkerMessage message) {
        if (message == null || message.type() != MessageType.EXECUTE_TASK) {
            log.error("Unknown task message type received: " + (message == null ? "null" : message.type()), null);
            return;
        }
        String taskId = message.taskId();
        String taskName = message.taskName();
        Optional<TaskHandler> handler = registry.find(taskName);
        if (handler.isEmpty()) {
            String error = "Unknown task: " + taskName;
            log.error(error + " (available: " + registry.taskNames() + ")", null);
            reply(WorkerMessage.taskError(taskId, error, TaskFailureException.DEFAULT_CODE));
            return;
        }
        TaskArguments args = TaskArguments.of(message.argsOrEmpty());
        executor.execute(() -> runTask(taskId, taskName, handler.get(), args));
    }

    private void runTask(String taskId, String taskName, TaskHandler handler, TaskArguments args) {
        WorkerMessage reply;
        try {
            Object result = handler.handle(args);
            JsonNode node = Jsons.compactMapper().valueToTree(result);
            reply = WorkerMessage.taskComplete(taskId, node);
        } catch (Exception e) {
            log.error("Task " + taskName + " failed (taskId=" + taskId + ", code=" + TaskFailureException.codeOf(e) + ")", e);
            String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            reply = WorkerMessage.taskError(taskId, error, TaskFailureException.codeOf(e));
        }
        reply(reply);
    }

    private void reply(WorkerMessage reply) {
        try {
            replies.send(reply);
        } catch (IOException | RuntimeException e) {
            fatalHandler.accept(e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        executor.shutdown();
        return executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private static ThreadFactory taskThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "taskhost-task-" + THREAD_SEQ.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    public interface ReplySink {
        void send(WorkerMessage reply) throws IOException;
    }
}
