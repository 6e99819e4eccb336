package io.taskhost.worker;

/**
 * A handler failure with an explicit reply code. Plain exceptions reply with
 * {@link #DEFAULT_CODE}.
 */
public class TaskFailureException extends Exception {
    public static final int DEFAULT_CODE = -1;

    private final int code;

    public TaskFailureException(String message) {
        this(message, DEFAULT_CODE, null);
    }

    public TaskFailureException(String message, int code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static int codeOf(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TaskFailureException failure) {
                return failure.code();
            }
            current = current.getCause();
        }
        return DEFAULT_CODE;
    }
}
