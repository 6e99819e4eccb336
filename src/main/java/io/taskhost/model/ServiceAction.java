package io.taskhost.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

public enum ServiceAction {
    START,
    STOP,
    RESTART,
    STATUS,
    ENABLE,
    DISABLE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ServiceAction> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (ServiceAction value : values()) {
            if (value.wireName().equals(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static String allowedList() {
        return Arrays.stream(values()).map(ServiceAction::wireName).collect(Collectors.joining(", "));
    }
}
