package io.taskhost.worker;

@FunctionalInterface
public interface TaskHandler {
    /**
     * @return a value Jackson can serialize; it becomes the reply's {@code result}
     */
    Object handle(TaskArguments args) throws Exception;
}
