package io.taskhost.ipc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    EXECUTE_TASK("execute-task"),
    TASK_COMPLETE("task-complete"),
    TASK_ERROR("task-error"),
    WORKER_READY("worker-ready"),
    UNKNOWN("unknown");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static MessageType fromWire(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        for (MessageType value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
