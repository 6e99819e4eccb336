package io.taskhost.worker;

import io.taskhost.config.TaskHostConfig;
import io.taskhost.model.DiskInfo;
import io.taskhost.model.ServiceAction;
import io.taskhost.model.SystemInfo;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The worker's task catalog. Each constant is one named operation with its own argument
 * contract; validation failures are thrown as ordinary task failures.
 */
public enum SystemTask {
    INSTALL_DEB("install-deb") {
        @Override
        Object run(TaskArguments args, CommandRunner runner, WorkerLog log) throws Exception {
            String debPath = args.text(0);
            if (debPath == null || debPath.isEmpty()) {
                log.error("Invalid deb path provided: " + args.get(0), null);
                throw new TaskFailureException("Invalid deb path provided");
            }
            if (!debPath.endsWith(".deb")) {
                log.error("File must be a .deb package: " + debPath, null);
                throw new TaskFailureException("File must be a .deb package");
            }
            runner.run("pkexec dpkg -i " + shellQuote(debPath));
            return "Successfully installed: " + debPath;
        }
    },
    UPDATE_SYSTEM("update-system") {
        @Override
        Object run(TaskArguments args, CommandRunner runner, WorkerLog log) throws Exception {
            runner.run(
                    "pkexec apt update && pkexec apt upgrade -y",
                    CommandRunner.CommandOptions.withTimeout(TaskHostConfig.LONG_RUNNING_TASK_TIMEOUT_MS)
            );
            return "System update completed successfully";
        }
    },
    INSTALL_PACKAGE("install-package") {
        @Override
        Object run(TaskArguments args, CommandRunner runner, WorkerLog log) throws Exception {
            String packageName = args.text(0);
            if (packageName == null || packageName.isEmpty()) {
                throw new TaskFailureException("Invalid package name provided");
            }
            runner.run("pkexec apt install -y " + shellQuote(packageName));
            return "Successfully installed package: " + packageName;
        }
    },
    MANAGE_SERVICE("manage-service") {
        @Override
        Object run(TaskArguments args, CommandRunner runner, WorkerLog log) throws Exception {
            String serviceName = args.text(0);
            String rawAction = args.text(1);
            if (serviceName == null || serviceName.isEmpty() || rawAction == null || rawAction.isEmpty()) {
                throw new TaskFailureException("Service name and action are required");
            }
            ServiceAction action = ServiceAction.fromWire(rawAction)
                    .orElseThrow(() -> new TaskFailureException(
                            "Invalid action. Must be one of: " + ServiceAction.allowedList()));
            runner.run("pkexec systemctl " + action.wireName() + " " + shellQuote(serviceName));
            return "Service " + serviceName + " " + action.wireName() + " completed";
        }
    },
    CHECK_DISK_SPACE("check-disk-space") {
        @Override
        Object run(TaskArguments args, CommandRunner runner, WorkerLog log) throws Exception {
            List<DiskInfo> disks = parseDiskUsage(runner.run("df -h"));
            log.debug("check-disk-space parsed " + disks.size() + " filesystems");
            return disks;
        }
    },
    GET_SYSTEM_INFO("get-system-info") {
        @Override
        Object run(TaskArguments args, CommandRunner runner, WorkerLog log) throws Exception {
            String os = runner.run("lsb_release -a 2>/dev/null || cat /etc/os-release");
            String memory = runner.run("free -h");
            String cpu = runner.run("lscpu | head -20");
            return new SystemInfo(os, memory, cpu, Instant.now().toString());
        }
    };

    private final String taskName;

    SystemTask(String taskName) {
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }

    abstract Object run(TaskArguments args, CommandRunner runner, WorkerLog log) throws Exception;

    public TaskHandler handler(CommandRunner runner, WorkerLog log) {
        return args -> run(args, runner, log);
    }

    public static Optional<SystemTask> fromName(String taskName) {
        for (SystemTask task : values()) {
            if (task.taskName.equals(taskName)) {
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    static List<DiskInfo> parseDiskUsage(String dfOutput) {
        List<DiskInfo> out = new ArrayList<>();
        if (dfOutput == null || dfOutput.isBlank()) {
            return out;
        }
        String[] lines = dfOutput.split("\n");
        for (int i = 1; i < lines.length; i++) {
            String[] parts = lines[i].trim().split("\\s+");
            if (parts.length >= 6) {
                out.add(new DiskInfo(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]));
            }
        }
        return out;
    }

    static String shellQuote(String raw) {
        return "'" + raw.replace("'", "'\\''") + "'";
    }
}
