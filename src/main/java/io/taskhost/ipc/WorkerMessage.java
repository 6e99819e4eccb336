package io.taskhost.ipc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One discrete message on the worker pipe. Which fields are set depends on {@link #type()}:
 * dispatch carries {@code taskName}/{@code args}, completion carries {@code result},
 * error carries {@code error}/{@code code}, readiness carries {@code pid}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerMessage(
        MessageType type,
        String taskId,
        String taskName,
        List<JsonNode> args,
        JsonNode result,
        String error,
        Integer code,
        Long pid
) {
    public WorkerMessage {
        args = args == null ? null : List.copyOf(args);
    }

    public static WorkerMessage executeTask(String taskId, String taskName, List<JsonNode> args) {
        return new WorkerMessage(MessageType.EXECUTE_TASK, taskId, taskName, args == null ? List.of() : args,
                null, null, null, null);
    }

    public static WorkerMessage taskComplete(String taskId, JsonNode result) {
        return new WorkerMessage(MessageType.TASK_COMPLETE, taskId, null, null, result, null, null, null);
    }

    public static WorkerMessage taskError(String taskId, String error, int code) {
        return new WorkerMessage(MessageType.TASK_ERROR, taskId, null, null, null, error, code, null);
    }

    public static WorkerMessage workerReady(long pid) {
        return new WorkerMessage(MessageType.WORKER_READY, null, null, null, null, null, null, pid);
    }

    public List<JsonNode> argsOrEmpty() {
        return args == null ? List.of() : args;
    }
}
