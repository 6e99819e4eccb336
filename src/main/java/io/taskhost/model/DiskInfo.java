package io.taskhost.model;

public record DiskInfo(
        String filesystem,
        String size,
        String used,
        String available,
        String usePercent,
        String mountPoint
) {
}
