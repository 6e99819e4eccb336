package io.taskhost.ipc;

/**
 * Callbacks a {@link WorkerChannel} raises. Calls may arrive on transport threads.
 */
public interface WorkerEvents {
    void onMessage(WorkerMessage message);

    void onOutput(String stream, String line);

    void onExit(int exitCode);
}
