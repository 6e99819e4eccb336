package io.taskhost.supervisor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskhost.config.TaskHostConfig;
import io.taskhost.model.DiskInfo;
import io.taskhost.model.ServiceAction;
import io.taskhost.model.SystemInfo;

import java.util.List;

/**
 * Typed, blocking view of the task catalog. Failed results become
 * {@link TaskExecutionException}.
 */
public final class TaskManager {
    private static final TypeReference<List<DiskInfo>> DISK_LIST = new TypeReference<>() {
    };

    private final TaskExecutor executor;

    public TaskManager(TaskExecutor executor) {
        this.executor = executor;
    }

    public String installDeb(String debPath) {
        return text(expect("install-deb", executor.execute("install-deb", debPath).join(), "Failed to install deb package"));
    }

    public String updateSystem() {
        TaskResult result = executor.executeWithOptions(
                "update-system",
                TaskOptions.timeout(TaskHostConfig.LONG_RUNNING_TASK_TIMEOUT_MS)
        ).join();
        return text(expect("update-system", result, "Failed to update system"));
    }

    public String installPackage(String packageName) {
        return text(expect("install-package", executor.execute("install-package", packageName).join(), "Failed to install package"));
    }

    public String manageService(String serviceName, ServiceAction action) {
        String wire = action == null ? null : action.wireName();
        TaskResult result = executor.execute("manage-service", serviceName, wire).join();
        return text(expect("manage-service", result, "Failed to manage service"));
    }

    public List<DiskInfo> checkDiskSpace() {
        TaskResult result = executor.execute("check-disk-space").join();
        expect("check-disk-space", result, "Failed to check disk space");
        return result.dataAs(DISK_LIST);
    }

    public SystemInfo getSystemInfo() {
        TaskResult result = executor.execute("get-system-info").join();
        expect("get-system-info", result, "Failed to get system info");
        return result.dataAs(SystemInfo.class);
    }

    public JsonNode execute(String taskName, Object... args) {
        return expect(taskName, executor.execute(taskName, args).join(), "Task execution failed");
    }

    public JsonNode executeWithOptions(String taskName, TaskOptions options, Object... args) {
        return expect(taskName, executor.executeWithOptions(taskName, options, args).join(), "Task execution failed");
    }

    public boolean isAvailable() {
        return executor.isAvailable();
    }

    public List<String> getRecentLogs(int lines) {
        return executor.getRecentLogs(lines);
    }

    public void dispose() {
        executor.dispose();
    }

    private static String text(JsonNode data) {
        return data == null || data.isNull() ? null : data.asText();
    }

    private static JsonNode expect(String taskName, TaskResult result, String fallbackError) {
        if (result.success()) {
            return result.data();
        }
        String error = result.error() == null || result.error().isBlank() ? fallbackError : result.error();
        throw new TaskExecutionException(taskName, error, result.code());
    }
}
