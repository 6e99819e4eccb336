package io.taskhost.worker;

import com.fasterxml.jackson.databind.node.TextNode;
import io.taskhost.ipc.MessageType;
import io.taskhost.ipc.WorkerMessage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

final class WorkerDispatcherTest {

    @Test
    void successfulHandlerRepliesWithCompletion() throws Exception {
        BlockingQueue<WorkerMessage> replies = new LinkedBlockingQueue<>();
        TaskRegistry registry = new TaskRegistry(Map.of("echo", args -> "echo:" + args.text(0)));
        try (WorkerDispatcher dispatcher = new WorkerDispatcher(registry, replies::add, SystemTaskTest.quietLog(), Assertions::fail)) {
            dispatcher.dispatch(WorkerMessage.executeTask("task-1-1", "echo", List.of(TextNode.valueOf("hi"))));

            WorkerMessage reply = replies.poll(5, TimeUnit.SECONDS);
            Assertions.assertNotNull(reply);
            Assertions.assertEquals(MessageType.TASK_COMPLETE, reply.type());
            Assertions.assertEquals("task-1-1", reply.taskId());
            Assertions.assertEquals("echo:hi", reply.result().asText());
        }
    }

    @Test
    void handlerFailureRepliesWithMessageAndCode() throws Exception {
        BlockingQueue<WorkerMessage> replies = new LinkedBlockingQueue<>();
        TaskRegistry registry = new TaskRegistry(Map.of(
                "exit-code", args -> {
                    throw new CommandFailedException("'false' exit=1", 1);
                },
                "plain", args -> {
                    throw new IllegalStateException("disk on fire");
                }
        ));
        try (WorkerDispatcher dispatcher = new WorkerDispatcher(registry, replies::add, SystemTaskTest.quietLog(), Assertions::fail)) {
            dispatcher.dispatch(WorkerMessage.executeTask("task-1-1", "exit-code", List.of()));
            WorkerMessage first = replies.poll(5, TimeUnit.SECONDS);
            dispatcher.dispatch(WorkerMessage.executeTask("task-2-1", "plain", List.of()));
            WorkerMessage second = replies.poll(5, TimeUnit.SECONDS);

            Assertions.assertEquals(MessageType.TASK_ERROR, first.type());
            Assertions.assertEquals("Command failed: 'false' exit=1", first.error());
            Assertions.assertEquals(1, first.code());
            Assertions.assertEquals("disk on fire", second.error());
            Assertions.assertEquals(TaskFailureException.DEFAULT_CODE, second.code());
        }
    }

    @Test
    void unknownTaskRepliesImmediately() throws Exception {
        BlockingQueue<WorkerMessage> replies = new LinkedBlockingQueue<>();
        TaskRegistry registry = new TaskRegistry(Map.of("echo", args -> "x"));
        try (WorkerDispatcher dispatcher = new WorkerDispatcher(registry, replies::add, SystemTaskTest.quietLog(), Assertions::fail)) {
            dispatcher.dispatch(WorkerMessage.executeTask("task-9-1", "reboot", List.of()));

            WorkerMessage reply = replies.poll(0, TimeUnit.SECONDS);
            Assertions.assertNotNull(reply);
            Assertions.assertEquals("Unknown task: reboot", reply.error());
            Assertions.assertEquals(-1, reply.code());

            dispatcher.dispatch(WorkerMessage.taskComplete("task-9-1", TextNode.valueOf("x")));
            Assertions.assertNull(replies.poll(100, TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void slowTaskDoesNotBlockLaterDispatches() throws Exception {
        BlockingQueue<WorkerMessage> replies = new LinkedBlockingQueue<>();
        CountDownLatch release = new CountDownLatch(1);
        TaskRegistry registry = new TaskRegistry(Map.of(
                "slow", args -> {
                    release.await();
                    return "slow";
                },
                "fast", args -> "fast"
        ));
        try (WorkerDispatcher dispatcher = new WorkerDispatcher(registry, replies::add, SystemTaskTest.quietLog(), Assertions::fail)) {
            dispatcher.dispatch(WorkerMessage.executeTask("task-1-1", "slow", List.of()));
            dispatcher.dispatch(WorkerMessage.executeTask("task-2-1", "fast", List.of()));

            Assertions.assertEquals("task-2-1", replies.poll(5, TimeUnit.SECONDS).taskId());
            release.countDown();
            Assertions.assertEquals("task-1-1", replies.poll(5, TimeUnit.SECONDS).taskId());
        } finally {
            release.countDown();
        }
    }

    @Test
    void replyFailureGoesToTheFatalHandler() throws Exception {
        CompletableFuture<Throwable> fatal = new CompletableFuture<>();
        WorkerDispatcher.ReplySink broken = reply -> {
            throw new IOException("Broken pipe");
        };
        TaskRegistry registry = new TaskRegistry(Map.of("echo", args -> "x"));
        try (WorkerDispatcher dispatcher = new WorkerDispatcher(registry, broken, SystemTaskTest.quietLog(), fatal::complete)) {
            dispatcher.dispatch(WorkerMessage.executeTask("task-1-1", "echo", List.of()));

            Throwable error = fatal.get(5, TimeUnit.SECONDS);
            Assertions.assertEquals("Broken pipe", error.getMessage());
        }
    }
}
