package io.taskhost.supervisor;

public final class TaskExecutionException extends RuntimeException {
    private final String taskName;
    private final Integer code;

    public TaskExecutionException(String taskName, String message, Integer code) {
        super(message);
        this.taskName = taskName;
        this.code = code;
    }

    public String taskName() {
        return taskName;
    }

    public Integer code() {
        return code;
    }
}
