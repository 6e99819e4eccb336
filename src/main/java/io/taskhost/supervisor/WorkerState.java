package io.taskhost.supervisor;

public enum WorkerState {
    ABSENT,
    STARTING,
    RUNNING,
    RESTARTING,
    COOLED_DOWN,
    TERMINATED
}
