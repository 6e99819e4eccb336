package io.taskhost.model;

public record SystemInfo(
        String os,
        String memory,
        String cpu,
        String timestamp
) {
}
