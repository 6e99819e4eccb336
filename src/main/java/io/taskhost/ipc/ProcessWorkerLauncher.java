package io.taskhost.ipc;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Spawns the worker as a child process. Dispatch goes to the child's stdin, replies come
 * back on its stdout, and stderr carries the worker's own log lines.
 */
public final class ProcessWorkerLauncher implements WorkerLauncher {
    public static final String WORKER_MAIN_CLASS = "io.taskhost.Main";
    public static final String WORKER_SUBCOMMAND = "worker";

    private final List<String> command;
    private final Map<String, String> environment;
    private final long shutdownGraceMs;

    public ProcessWorkerLauncher(List<String> command, Map<String, String> environment, long shutdownGraceMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("worker command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.shutdownGraceMs = Math.max(0L, shutdownGraceMs);
    }

    /**
     * Runs the worker in a fresh JVM on the current classpath.
     */
    public static List<String> currentJvmCommand() {
        Path javaBin = Paths.get(System.getProperty("java.home"), "bin", "java");
        List<String> argv = new ArrayList<>();
        argv.add(javaBin.toString());
        argv.add("-cp");
        argv.add(System.getProperty("java.class.path"));
        argv.add(WORKER_MAIN_CLASS);
        argv.add(WORKER_SUBCOMMAND);
        return argv;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public WorkerChannel launch(WorkerEvents events) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.environment().putAll(environment);
        pb.redirectErrorStream(false);
        Process process = pb.start();
        ProcessWorkerChannel channel = new ProcessWorkerChannel(process, events, shutdownGraceMs);
        channel.startPumps();
        return channel;
    }

    static final class ProcessWorkerChannel implements WorkerChannel {
        private final Process process;
        private final WorkerEvents events;
        private final long shutdownGraceMs;
        private final BufferedWriter stdin;
        private final Thread stdoutPump;
        private final Thread stderrPump;

        ProcessWorkerChannel(Process process, WorkerEvents events, long shutdownGraceMs) {
            this.process = process;
            this.events = events;
            this.shutdownGraceMs = shutdownGraceMs;
            this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
            this.stdoutPump = new Thread(this::pumpStdout, "taskhost-worker-stdout-" + process.pid());
            this.stderrPump = new Thread(
                    () -> pumpLines(process.getErrorStream(), "stderr"),
                    "taskhost-worker-stderr-" + process.pid()
            );
            this.stdoutPump.setDaemon(true);
            this.stderrPump.setDaemon(true);
        }

        void startPumps() {
            stdoutPump.start();
            stderrPump.start();
            process.onExit().thenAccept(p -> {
                // Drain both pipes before reporting the exit so trailing replies are not lost.
                joinQuietly(stdoutPump);
                joinQuietly(stderrPump);
                events.onExit(p.exitValue());
            });
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public synchronized void send(WorkerMessage message) throws IOException {
            if (!process.isAlive()) {
                throw new IOException("worker process " + process.pid() + " is not alive");
            }
            stdin.write(MessageCodec.encode(message));
            stdin.newLine();
            stdin.flush();
        }

        @Override
        public void terminate() {
            try {
                stdin.close();
            } catch (IOException ignored) {
                // Pipe already broken; the process is going away either way.
            }
            process.destroy();
            try {
                if (!process.waitFor(shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }

        private void pumpStdout() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    WorkerMessage message;
                    try {
                        message = MessageCodec.decode(line);
                    } catch (MessageCodec.MalformedMessageException e) {
                        events.onOutput("stdout", line);
                        continue;
                    }
                    events.onMessage(message);
                }
            } catch (IOException e) {
                events.onOutput("stderr", "worker stdout closed: " + e.getMessage());
            }
        }

        private void pumpLines(InputStream stream, String name) {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    events.onOutput(name, line);
                }
            } catch (IOException e) {
                events.onOutput("stderr", "worker " + name + " closed: " + e.getMessage());
            }
        }

        private static void joinQuietly(Thread thread) {
            try {
                thread.join(1_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
