package io.taskhost.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.taskhost.config.TaskHostConfig;
import io.taskhost.model.DiskInfo;
import io.taskhost.model.SystemInfo;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

final class SystemTaskTest {
    private static final String DF_OUTPUT = String.join("\n",
            "Filesystem      Size  Used Avail Use% Mounted on",
            "/dev/sda1        50G   20G   28G  42% /",
            "tmpfs           7.8G     0  7.8G   0% /dev/shm",
            "broken line");

    @Test
    void registryExposesTheWholeCatalogInOrder() {
        TaskRegistry registry = TaskRegistry.systemTasks(new RecordingCommandRunner(), quietLog());

        Assertions.assertEquals(
                List.of("install-deb", "update-system", "install-package", "manage-service", "check-disk-space", "get-system-info"),
                List.copyOf(registry.taskNames())
        );
        Assertions.assertEquals(SystemTask.MANAGE_SERVICE, SystemTask.fromName("manage-service").orElseThrow());
        Assertions.assertTrue(SystemTask.fromName("reboot").isEmpty());
    }

    @Test
    void installDebValidatesPathBeforeRunningAnything() throws Exception {
        RecordingCommandRunner runner = new RecordingCommandRunner().answer("pkexec dpkg", "");

        TaskFailureException missing = Assertions.assertThrows(TaskFailureException.class,
                () -> run(SystemTask.INSTALL_DEB, runner));
        TaskFailureException notText = Assertions.assertThrows(TaskFailureException.class,
                () -> run(SystemTask.INSTALL_DEB, runner, IntNode.valueOf(7)));
        TaskFailureException wrongKind = Assertions.assertThrows(TaskFailureException.class,
                () -> run(SystemTask.INSTALL_DEB, runner, TextNode.valueOf("/tmp/app.rpm")));

        Assertions.assertEquals("Invalid deb path provided", missing.getMessage());
        Assertions.assertEquals("Invalid deb path provided", notText.getMessage());
        Assertions.assertEquals("File must be a .deb package", wrongKind.getMessage());
        Assertions.assertTrue(runner.commands().isEmpty());

        Object result = run(SystemTask.INSTALL_DEB, runner, TextNode.valueOf("/tmp/my app.deb"));
        Assertions.assertEquals("Successfully installed: /tmp/my app.deb", result);
        Assertions.assertEquals(List.of("pkexec dpkg -i '/tmp/my app.deb'"), runner.commands());
    }

    @Test
    void updateSystemUsesTheLongCommandTimeout() throws Exception {
        RecordingCommandRunner runner = new RecordingCommandRunner().answer("pkexec apt update", "done");

        Object result = run(SystemTask.UPDATE_SYSTEM, runner);

        Assertions.assertEquals("System update completed successfully", result);
        Assertions.assertEquals(List.of("pkexec apt update && pkexec apt upgrade -y"), runner.commands());
        Assertions.assertEquals(TaskHostConfig.LONG_RUNNING_TASK_TIMEOUT_MS, runner.options().get(0).timeoutMs());
    }

    @Test
    void installPackageQuotesTheName() throws Exception {
        RecordingCommandRunner runner = new RecordingCommandRunner().answer("pkexec apt install", "");

        Assertions.assertEquals("Invalid package name provided",
                Assertions.assertThrows(TaskFailureException.class,
                        () -> run(SystemTask.INSTALL_PACKAGE, runner, TextNode.valueOf(""))).getMessage());

        Object result = run(SystemTask.INSTALL_PACKAGE, runner, TextNode.valueOf("htop; rm -rf /"));

        Assertions.assertEquals("Successfully installed package: htop; rm -rf /", result);
        Assertions.assertEquals(List.of("pkexec apt install -y 'htop; rm -rf /'"), runner.commands());
    }

    @Test
    void manageServiceChecksArgumentsAndAction() throws Exception {
        RecordingCommandRunner runner = new RecordingCommandRunner().answer("pkexec systemctl", "");

        TaskFailureException missing = Assertions.assertThrows(TaskFailureException.class,
                () -> run(SystemTask.MANAGE_SERVICE, runner, TextNode.valueOf("nginx")));
        TaskFailureException invalid = Assertions.assertThrows(TaskFailureException.class,
                () -> run(SystemTask.MANAGE_SERVICE, runner, TextNode.valueOf("nginx"), TextNode.valueOf("reload")));

        Assertions.assertEquals("Service name and action are required", missing.getMessage());
        Assertions.assertEquals("Invalid action. Must be one of: start, stop, restart, status, enable, disable",
                invalid.getMessage());
        Assertions.assertEquals(TaskFailureException.DEFAULT_CODE, invalid.code());

        Object result = run(SystemTask.MANAGE_SERVICE, runner, TextNode.valueOf("nginx"), TextNode.valueOf("restart"));
        Assertions.assertEquals("Service nginx restart completed", result);
        Assertions.assertEquals(List.of("pkexec systemctl restart 'nginx'"), runner.commands());
    }

    @Test
    void commandFailureKeepsTheExitCode() {
        RecordingCommandRunner runner = new RecordingCommandRunner().failWith(4);

        TaskFailureException failure = Assertions.assertThrows(TaskFailureException.class,
                () -> run(SystemTask.MANAGE_SERVICE, runner, TextNode.valueOf("ghost"), TextNode.valueOf("start")));

        Assertions.assertEquals(4, failure.code());
        Assertions.assertTrue(failure.getMessage().startsWith("Command failed: "), failure.getMessage());
    }

    @Test
    void checkDiskSpaceParsesDfRows() throws Exception {
        RecordingCommandRunner runner = new RecordingCommandRunner().answer("df -h", DF_OUTPUT);

        Object result = run(SystemTask.CHECK_DISK_SPACE, runner);

        Assertions.assertEquals(List.of(
                new DiskInfo("/dev/sda1", "50G", "20G", "28G", "42%", "/"),
                new DiskInfo("tmpfs", "7.8G", "0", "7.8G", "0%", "/dev/shm")
        ), result);
        Assertions.assertTrue(SystemTask.parseDiskUsage("").isEmpty());
        Assertions.assertTrue(SystemTask.parseDiskUsage("Filesystem Size Used Avail Use% Mounted on").isEmpty());
    }

    @Test
    void getSystemInfoCollectsThreeCommands() throws Exception {
        RecordingCommandRunner runner = new RecordingCommandRunner()
                .answer("lsb_release", "Ubuntu 24.04")
                .answer("free -h", "Mem: 16Gi")
                .answer("lscpu", "x86_64");

        SystemInfo info = (SystemInfo) run(SystemTask.GET_SYSTEM_INFO, runner);

        Assertions.assertEquals("Ubuntu 24.04", info.os());
        Assertions.assertEquals("Mem: 16Gi", info.memory());
        Assertions.assertEquals("x86_64", info.cpu());
        Assertions.assertNotNull(info.timestamp());
        Assertions.assertEquals(3, runner.commands().size());
    }

    @Test
    void shellQuoteEscapesSingleQuotes() {
        Assertions.assertEquals("'it'\\''s'", SystemTask.shellQuote("it's"));
        Assertions.assertEquals("''", SystemTask.shellQuote(""));
    }

    private static Object run(SystemTask task, CommandRunner runner, JsonNode... args) throws Exception {
        return task.handler(runner, quietLog()).handle(TaskArguments.of(Arrays.asList(args)));
    }

    static WorkerLog quietLog() {
        return new WorkerLog(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }
}
