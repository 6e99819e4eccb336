package io.taskhost.ipc;

import java.io.IOException;

@FunctionalInterface
public interface WorkerLauncher {
    WorkerChannel launch(WorkerEvents events) throws IOException;
}
