package io.taskhost.worker;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

public final class ShellCommandRunner implements CommandRunner {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long PUMP_JOIN_MS = 1_000L;

    private final List<String> shell;

    public ShellCommandRunner() {
        this(List.of("/bin/sh", "-c"));
    }

    public ShellCommandRunner(List<String> shell) {
        if (shell == null || shell.isEmpty()) {
            throw new IllegalArgumentException("shell prefix cannot be empty");
        }
        this.shell = List.copyOf(shell);
    }

    @Override
    public String run(String commandLine, CommandOptions options) throws CommandFailedException {
        if (commandLine == null || commandLine.isBlank()) {
            throw new CommandFailedException("empty command line", TaskFailureException.DEFAULT_CODE);
        }
        CommandOptions effective = options == null ? CommandOptions.defaults() : options;
        ProcessBuilder pb = new ProcessBuilder(argv(commandLine));
        pb.redirectErrorStream(false);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new CommandFailedException("spawn failed for '" + commandLine + "': " + e.getMessage(), e);
        }

        BoundedCapture stdout = new BoundedCapture(process, process.getInputStream(), effective.maxOutputBytes());
        BoundedCapture stderr = new BoundedCapture(process, process.getErrorStream(), effective.maxOutputBytes());
        Thread stdoutPump = new Thread(stdout, "taskhost-cmd-stdout-" + process.pid());
        Thread stderrPump = new Thread(stderr, "taskhost-cmd-stderr-" + process.pid());
        stdoutPump.setDaemon(true);
        stderrPump.setDaemon(true);
        stdoutPump.start();
        stderrPump.start();

        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(effective.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new CommandFailedException(
                        "'" + commandLine + "' timed out after " + Duration.ofMillis(effective.timeoutMs()),
                        TaskFailureException.DEFAULT_CODE
                );
            }
            stdoutPump.join(PUMP_JOIN_MS);
            stderrPump.join(PUMP_JOIN_MS);
            if (stdout.overflowed() || stderr.overflowed()) {
                throw new CommandFailedException(
                        "'" + commandLine + "' exceeded output limit of " + effective.maxOutputBytes() + " bytes",
                        TaskFailureException.DEFAULT_CODE
                );
            }
            int exit = process.exitValue();
            if (exit != 0) {
                String detail = truncate(stderr.text());
                throw new CommandFailedException(
                        "'" + commandLine + "' exit=" + exit + (detail.isEmpty() ? "" : " stderr=" + detail),
                        exit
                );
            }
            return stdout.text().trim();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CommandFailedException("'" + commandLine + "' interrupted", e);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new CommandFailedException("'" + commandLine + "' io failure: " + e.getMessage(), e);
        }
    }

    private List<String> argv(String commandLine) {
        List<String> out = new ArrayList<>(shell);
        out.add(commandLine);
        return out;
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    private static final class BoundedCapture implements Runnable {
        private final Process process;
        private final InputStream in;
        private final long limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private volatile boolean overflow;

        BoundedCapture(Process process, InputStream in, long limit) {
            this.process = process;
            this.in = in;
            this.limit = limit;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream stream = in) {
                int n;
                while ((n = stream.read(chunk)) != -1) {
                    if ((long) buffer.size() + n > limit) {
                        overflow = true;
                        process.destroyForcibly();
                        return;
                    }
                    synchronized (buffer) {
                        buffer.write(chunk, 0, n);
                    }
                }
            } catch (IOException ignored) {
                // Stream closed by destroyForcibly(); whatever was captured stays.
            }
        }

        boolean overflowed() {
            return overflow;
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
