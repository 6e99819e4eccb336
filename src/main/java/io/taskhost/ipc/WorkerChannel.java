package io.taskhost.ipc;

import java.io.IOException;

public interface WorkerChannel {
    long pid();

    void send(WorkerMessage message) throws IOException;

    /**
     * Stops the worker. {@link WorkerEvents#onExit(int)} still fires afterwards.
     */
    void terminate();
}
