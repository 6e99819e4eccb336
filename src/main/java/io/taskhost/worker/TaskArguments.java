package io.taskhost.worker;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Positional task arguments as they arrived on the pipe.
 */
public final class TaskArguments {
    private final List<JsonNode> values;

    public TaskArguments(List<JsonNode> values) {
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    public static TaskArguments of(List<JsonNode> values) {
        return new TaskArguments(values);
    }

    public int size() {
        return values.size();
    }

    public JsonNode get(int index) {
        if (index < 0 || index >= values.size()) {
            return null;
        }
        return values.get(index);
    }

    /**
     * The argument as text, or {@code null} when it is missing or not a JSON string.
     */
    public String text(int index) {
        JsonNode node = get(index);
        if (node == null || !node.isTextual()) {
            return null;
        }
        return node.asText();
    }

    public List<JsonNode> values() {
        return values;
    }
}
